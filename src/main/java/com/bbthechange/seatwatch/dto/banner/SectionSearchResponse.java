package com.bbthechange.seatwatch.dto.banner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope of the section search response: {"success": true, "data": [...]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SectionSearchResponse {

    private Boolean success;

    private Integer totalCount;

    private List<SectionRecord> data;
}
