package com.bbthechange.seatwatch.service;

import com.bbthechange.seatwatch.model.TrackedSection;
import org.springframework.stereotype.Component;

/**
 * Shared text generator for section notifications and tracked-section summaries.
 */
@Component
public class SeatNotificationTextGenerator {

    public static final String SECTION_OPENED_TITLE = "Section Open";

    /**
     * Generate body text for a section-opened notification.
     * Example: "OPEN: ENGL214-02 - 30577\nAvailable Seats: 3"
     */
    public String getSectionOpenedBody(TrackedSection section) {
        return String.format("OPEN: %s - %s\nAvailable Seats: %d",
                section.getLabel(), section.getCrn(), section.getAvailableSeats());
    }

    /**
     * Generate the summary block for one tracked section.
     */
    public String getTrackedSummary(TrackedSection section) {
        return String.format("%s  -  %s\nAvailable Seats: %d\nWaiting list: %s",
                section.getLabel(),
                section.getCrn(),
                section.getAvailableSeats(),
                section.isWaitingListOpen() ? "Open" : "Closed");
    }
}
