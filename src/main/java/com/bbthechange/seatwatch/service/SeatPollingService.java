package com.bbthechange.seatwatch.service;

import com.bbthechange.seatwatch.dto.SweepResult;

/**
 * Service for sweeping all tracked sections against the registration platform.
 */
public interface SeatPollingService {

    /**
     * Run one sweep.
     *
     * Process, for every tracked section of every user:
     * 1. Query the platform for the section's term, subject and course number
     * 2. Find the record with the same CRN and normalized section number (skip if none)
     * 3. Evaluate its availability and store it
     * 4. Notify the user if the section went from closed to open
     *
     * A failing query only affects its own section. Sweeps never overlap; a call made while
     * another sweep runs waits for it to finish.
     *
     * @return SweepResult containing statistics about the sweep
     */
    SweepResult sweep();
}
