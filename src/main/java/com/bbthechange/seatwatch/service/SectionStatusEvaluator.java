package com.bbthechange.seatwatch.service;

import com.bbthechange.seatwatch.dto.banner.SectionRecord;
import com.bbthechange.seatwatch.model.AvailabilityStatus;
import org.springframework.stereotype.Component;

/**
 * Derives seat and waitlist availability from a raw section record.
 * Missing fields degrade to the closed defaults; evaluation never fails.
 */
@Component
public class SectionStatusEvaluator {

    public AvailabilityStatus evaluate(SectionRecord record) {
        if (record == null) {
            return AvailabilityStatus.closed();
        }

        Integer seats = record.getSeatsAvailable();

        // Unknown seat count does not block an explicitly open section
        boolean open = Boolean.TRUE.equals(record.getOpenSection()) && (seats == null || seats > 0);

        return new AvailabilityStatus(
                // Over-enrolled sections report negative seats
                seats != null ? Math.max(0, seats) : 0,
                isWaitingListOpen(record),
                open
        );
    }

    /**
     * Any positive waitlist signal is enough; the field names vary by deployment.
     */
    private boolean isWaitingListOpen(SectionRecord record) {
        return Boolean.TRUE.equals(record.getWaitAvailable())
                || isPositive(record.getWaitCount())
                || isPositive(record.getWaitCapacity());
    }

    private static boolean isPositive(Integer value) {
        return value != null && value > 0;
    }
}
