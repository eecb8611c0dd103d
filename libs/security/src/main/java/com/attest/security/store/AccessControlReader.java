package com.attest.security.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Consistent read view over roles and permissions, obtained from {@link
 * AccessControlStore#snapshot()}.
 */
public interface AccessControlReader {

    /**
     * Batched role lookup. Ids with no stored role are absent from the result.
     *
     * @return roles keyed by id
     */
    Map<String, Role> findRolesByIds(Collection<String> roleIds);

    /**
     * Registered permissions granted directly by a role. Codes the role lists but whose permission
     * was removed are not returned.
     */
    List<Permission> findPermissionsByRoleId(String roleId);
}
