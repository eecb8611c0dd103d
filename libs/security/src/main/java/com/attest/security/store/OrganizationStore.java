package com.attest.security.store;

import java.util.Optional;

public interface OrganizationStore {

    Optional<Organization> findOrganizationById(String organizationId);
}
