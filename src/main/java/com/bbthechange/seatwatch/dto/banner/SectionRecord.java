package com.bbthechange.seatwatch.dto.banner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One section row returned by the registration platform's search endpoint.
 * Only the fields used for matching and availability are mapped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SectionRecord {

    /**
     * CRN of the section. Sent as a string or a number depending on deployment.
     */
    private String courseReferenceNumber;

    /**
     * Section number, e.g. "02" or "2".
     */
    private String sequenceNumber;

    private String term;
    private String subject;
    private String courseNumber;
    private String courseTitle;

    private Integer maximumEnrollment;
    private Integer enrollment;
    private Integer seatsAvailable;

    private Boolean openSection;

    // Waitlist fields differ between deployments, any of them may be missing
    private Boolean waitAvailable;
    private Integer waitCount;
    private Integer waitCapacity;
}
