package com.bbthechange.seatwatch.dto;

import com.bbthechange.seatwatch.model.TrackedSection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tracked section with its last known availability, as shown to the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackedSectionDTO {

    private String label;
    private String term;
    private String subject;
    private String courseNumber;
    private String section;
    private String crn;
    private int availableSeats;
    private boolean waitingListOpen;
    private boolean open;
    private String summary;

    public static TrackedSectionDTO from(TrackedSection section, String summary) {
        return TrackedSectionDTO.builder()
                .label(section.getLabel())
                .term(section.getTerm())
                .subject(section.getSubject())
                .courseNumber(section.getCourseNumber())
                .section(section.getSection())
                .crn(section.getCrn())
                .availableSeats(section.getAvailableSeats())
                .waitingListOpen(section.isWaitingListOpen())
                .open(section.isOpen())
                .summary(summary)
                .build();
    }
}
