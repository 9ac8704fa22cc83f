package com.bbthechange.seatwatch.service;

import com.bbthechange.seatwatch.dto.TrackSectionRequest;
import com.bbthechange.seatwatch.dto.TrackedSectionDTO;

import java.util.List;

/**
 * Command-side operations on a user's tracked sections.
 */
public interface TrackedSectionService {

    /**
     * Start tracking a section. The new item has closed status until the next sweep matches it.
     *
     * @throws com.bbthechange.seatwatch.exception.DuplicateTrackedSectionException if the CRN is already tracked
     * @throws com.bbthechange.seatwatch.exception.ValidationException if a field is missing
     */
    TrackedSectionDTO track(String userId, TrackSectionRequest request);

    /**
     * @return false if the user did not track the CRN
     */
    boolean untrack(String userId, String crn);

    void clear(String userId);

    List<TrackedSectionDTO> getTracked(String userId);
}
