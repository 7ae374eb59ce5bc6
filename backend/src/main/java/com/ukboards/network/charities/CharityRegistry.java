package com.ukboards.network.charities;

import com.ukboards.network.model.CharityId;
import com.ukboards.network.model.CharityRecord;
import com.ukboards.network.model.TrusteeRecord;

import java.util.List;
import java.util.Optional;

/**
 * Charity Commission lookups used to build charity networks.
 */
public interface CharityRegistry {

    /**
     * @return empty when the registry has no record or answered with a fault
     */
    Optional<CharityRecord> charity(CharityId charityNumber);

    /**
     * Trustees of one subsidiary of a charity; empty when none are listed.
     */
    List<TrusteeRecord> trustees(CharityId charityNumber, int subsidiaryNumber);

    List<CharityRecord> charitiesByName(String name);
}
