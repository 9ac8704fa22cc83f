package com.bbthechange.seatwatch.repository;

import com.bbthechange.seatwatch.model.AvailabilityStatus;
import com.bbthechange.seatwatch.model.TrackedSection;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-user store of tracked sections and their last known status.
 * Items returned by this repository are copies; callers never hold the stored instances.
 */
public interface TrackedSectionRepository {

    /**
     * Append a new section for the user with closed status.
     * Subject is upper-cased and the section zero-padded before storage.
     *
     * @return copy of the stored item
     * @throws com.bbthechange.seatwatch.exception.DuplicateTrackedSectionException
     *         if the user already tracks the CRN; the list is left unchanged
     */
    TrackedSection add(String userId, String term, String subject, String courseNumber, String section, String crn);

    /**
     * @return true if an item with the CRN was removed
     */
    boolean remove(String userId, String crn);

    void clear(String userId);

    /**
     * Items of the user in insertion order; empty if the user tracks nothing.
     */
    List<TrackedSection> list(String userId);

    /**
     * Overwrite the status fields of the matching item.
     *
     * @return the status stored before the update, or empty if the item no longer exists
     */
    Optional<AvailabilityStatus> updateStatus(String userId, String crn, AvailabilityStatus status);

    /**
     * Copy of every user's items, for one sweep.
     */
    Map<String, List<TrackedSection>> snapshot();

    /**
     * Number of tracked sections across all users.
     */
    int countAll();
}
