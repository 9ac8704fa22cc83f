package com.bbthechange.seatwatch.service;

import com.bbthechange.seatwatch.model.TrackedSection;

/**
 * Delivery channel for "section opened" notifications.
 * The sweep calls it once per closed-to-open transition; formatting and delivery are up to the implementation.
 */
public interface SeatOpeningNotifier {

    /**
     * Notify a user that a tracked section became open.
     *
     * @param userId The user tracking the section
     * @param section Copy of the tracked section carrying the new seat count
     */
    void onBecameOpen(String userId, TrackedSection section);
}
