package com.attest.security.store;

/**
 * Source of roles and permissions for permission resolution.
 */
public interface AccessControlStore {

    /**
     * A read view in which every lookup observes the same committed state, so a concurrent role
     * update is seen entirely or not at all.
     */
    AccessControlReader snapshot();
}
