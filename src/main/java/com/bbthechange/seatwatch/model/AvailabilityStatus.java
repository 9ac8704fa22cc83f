package com.bbthechange.seatwatch.model;

/**
 * Seat and waitlist availability derived from one platform section record.
 * Recomputed on every poll and copied into the tracked section.
 */
public record AvailabilityStatus(
    int availableSeats,
    boolean waitingListOpen,
    boolean open
) {
    /**
     * Status of a section that has not been matched yet.
     */
    public static AvailabilityStatus closed() {
        return new AvailabilityStatus(0, false, false);
    }
}
