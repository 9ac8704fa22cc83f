package com.bbthechange.seatwatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for tracking a section.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackSectionRequest {

    @NotBlank(message = "Term is required")
    @Pattern(regexp = "\\s*[A-Za-z0-9]+\\s*", message = "Term must be alphanumeric")
    private String term;

    @NotBlank(message = "Subject is required")
    @Pattern(regexp = "\\s*[A-Za-z0-9]+\\s*", message = "Subject must be alphanumeric")
    private String subject;

    @NotBlank(message = "Course number is required")
    @Pattern(regexp = "\\s*[A-Za-z0-9]+\\s*", message = "Course number must be alphanumeric")
    private String courseNumber;

    @NotBlank(message = "Section is required")
    @Pattern(regexp = "\\s*[A-Za-z0-9]+\\s*", message = "Section must be alphanumeric")
    private String section;

    @NotBlank(message = "CRN is required")
    @Pattern(regexp = "\\s*[0-9]+\\s*", message = "CRN must be numeric")
    private String crn;

    // Input sanitization in getters
    public String getTerm() {
        return term != null ? term.trim() : null;
    }

    public String getSubject() {
        return subject != null ? subject.trim() : null;
    }

    public String getCourseNumber() {
        return courseNumber != null ? courseNumber.trim() : null;
    }

    public String getSection() {
        return section != null ? section.trim() : null;
    }

    public String getCrn() {
        return crn != null ? crn.trim() : null;
    }
}
