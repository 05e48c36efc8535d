package com.crewlife.booking.service;

/**
 * External roster of invited candidates, consulted before a code is issued.
 */
public interface CandidateSource {

    /**
     * @return true if the roster lists this candidate for the brand and position
     */
    boolean verifyCandidate(String brand, String email, String textForEmail);
}
