package com.bbthechange.seatwatch.exception;

/**
 * Exception thrown when a user tries to track a CRN they already track.
 *
 * This is a 409 Conflict error indicating the resource state prevents the operation.
 */
public class DuplicateTrackedSectionException extends RuntimeException {

    private final String userId;
    private final String crn;

    public DuplicateTrackedSectionException(String userId, String crn) {
        super("CRN " + crn + " is already tracked");
        this.userId = userId;
        this.crn = crn;
    }

    public String getUserId() {
        return userId;
    }

    public String getCrn() {
        return crn;
    }
}
