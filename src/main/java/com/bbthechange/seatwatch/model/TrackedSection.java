package com.bbthechange.seatwatch.model;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One user's watch on one course section.
 * Identity fields are fixed at creation; the status fields are refreshed by the sweep.
 */
@Data
@NoArgsConstructor
public class TrackedSection {

    private String term;
    private String subject;
    private String courseNumber;
    private String section;
    private String crn;

    private int availableSeats;
    private boolean waitingListOpen;
    private boolean open;

    public TrackedSection(String term, String subject, String courseNumber, String section, String crn) {
        this.term = term;
        this.subject = subject;
        this.courseNumber = courseNumber;
        this.section = section;
        this.crn = crn;
    }

    /**
     * Copy constructor used to hand out snapshots of stored items.
     */
    public TrackedSection(TrackedSection other) {
        this(other.term, other.subject, other.courseNumber, other.section, other.crn);
        this.availableSeats = other.availableSeats;
        this.waitingListOpen = other.waitingListOpen;
        this.open = other.open;
    }

    public AvailabilityStatus getStatus() {
        return new AvailabilityStatus(availableSeats, waitingListOpen, open);
    }

    public void applyStatus(AvailabilityStatus status) {
        this.availableSeats = status.availableSeats();
        this.waitingListOpen = status.waitingListOpen();
        this.open = status.open();
    }

    /**
     * Display label in the form SUBJECT + course number + "-" + section, e.g. ENGL214-02.
     */
    public String getLabel() {
        return subject + courseNumber + "-" + section;
    }
}
