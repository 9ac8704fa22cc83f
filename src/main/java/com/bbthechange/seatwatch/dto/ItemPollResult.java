package com.bbthechange.seatwatch.dto;

import com.bbthechange.seatwatch.model.AvailabilityStatus;

/**
 * Outcome of polling one tracked section in one sweep.
 * A FAILED result carries the error and no status; nothing was stored or sent for it.
 */
public final class ItemPollResult {

    public enum Outcome {
        /**
         * Status refreshed, no transition to open.
         */
        UPDATED,

        /**
         * Status refreshed and the section went from closed to open.
         */
        OPENED,

        /**
         * The search returned no section with this CRN and section number.
         */
        NOT_MATCHED,

        /**
         * The item was removed before its status could be stored.
         */
        REMOVED,

        /**
         * The query failed; status left unchanged.
         */
        FAILED
    }

    private final String userId;
    private final String crn;
    private final Outcome outcome;
    private final AvailabilityStatus status;
    private final Exception error;

    private ItemPollResult(String userId, String crn, Outcome outcome, AvailabilityStatus status, Exception error) {
        this.userId = userId;
        this.crn = crn;
        this.outcome = outcome;
        this.status = status;
        this.error = error;
    }

    public static ItemPollResult updated(String userId, String crn, AvailabilityStatus status) {
        return new ItemPollResult(userId, crn, Outcome.UPDATED, status, null);
    }

    public static ItemPollResult opened(String userId, String crn, AvailabilityStatus status) {
        return new ItemPollResult(userId, crn, Outcome.OPENED, status, null);
    }

    public static ItemPollResult notMatched(String userId, String crn) {
        return new ItemPollResult(userId, crn, Outcome.NOT_MATCHED, null, null);
    }

    public static ItemPollResult removed(String userId, String crn) {
        return new ItemPollResult(userId, crn, Outcome.REMOVED, null, null);
    }

    public static ItemPollResult failed(String userId, String crn, Exception error) {
        return new ItemPollResult(userId, crn, Outcome.FAILED, null, error);
    }

    public String getUserId() {
        return userId;
    }

    public String getCrn() {
        return crn;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public AvailabilityStatus getStatus() {
        return status;
    }

    public Exception getError() {
        return error;
    }

    @Override
    public String toString() {
        return "ItemPollResult{" +
                "userId='" + userId + '\'' +
                ", crn='" + crn + '\'' +
                ", outcome=" + outcome +
                '}';
    }
}
