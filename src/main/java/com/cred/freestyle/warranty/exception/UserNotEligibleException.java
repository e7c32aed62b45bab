package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a user is unknown, inactive, or not allowed to register serials.
 *
 * @author Warranty Platform Team
 */
public class UserNotEligibleException extends RuntimeException {

    private final String userId;

    public UserNotEligibleException(String userId) {
        super(String.format("User %s is not eligible to register serial numbers", userId));
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
