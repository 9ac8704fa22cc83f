package com.bbthechange.seatwatch.service.impl;

import com.bbthechange.seatwatch.model.TrackedSection;
import com.bbthechange.seatwatch.service.SeatNotificationTextGenerator;
import com.bbthechange.seatwatch.service.SeatOpeningNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier that writes the notification text to the log.
 * Registered only when no other {@link SeatOpeningNotifier} bean is present.
 */
public class LoggingSeatOpeningNotifier implements SeatOpeningNotifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingSeatOpeningNotifier.class);

    private final SeatNotificationTextGenerator textGenerator;

    public LoggingSeatOpeningNotifier(SeatNotificationTextGenerator textGenerator) {
        this.textGenerator = textGenerator;
    }

    @Override
    public void onBecameOpen(String userId, TrackedSection section) {
        logger.info("[{}] {} for user {}: {}", SeatNotificationTextGenerator.SECTION_OPENED_TITLE,
                section.getCrn(), userId, textGenerator.getSectionOpenedBody(section));
    }
}
