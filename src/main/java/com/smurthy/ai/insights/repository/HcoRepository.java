package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.OrganizationRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read and partial-update access to healthcare organizations.
 */
public interface HcoRepository {

    String ADDRESS = "address";
    String CITY = "city";
    String STATE = "state";
    String ZIP_CODE = "zip_code";
    String ADDRESS_LAST_UPDATED = "address_last_updated";
    String UPDATED_AT = "updated_at";

    /**
     * Finds an organization by exact case-insensitive name, falling back to a
     * case-insensitive substring match.
     */
    Optional<OrganizationRecord> findByName(String name);

    /**
     * Organizations with the most ghost patients, highest first.
     */
    List<OrganizationRecord> findTopByGhostPatients(int limit);

    /**
     * Sets only the given columns on one organization.
     *
     * @return true if a row was updated
     */
    boolean updatePartial(String id, Map<String, Object> fields);
}
