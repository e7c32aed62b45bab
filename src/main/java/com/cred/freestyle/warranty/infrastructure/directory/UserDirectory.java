package com.cred.freestyle.warranty.infrastructure.directory;

/**
 * Lookup of customer eligibility for serial registration.
 *
 * @author Warranty Platform Team
 */
public interface UserDirectory {

    /**
     * @param userId Customer user ID
     * @return true if the user exists, is active and may register serial numbers
     */
    boolean isEligibleToRegister(String userId);
}
