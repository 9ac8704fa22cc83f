package com.bbthechange.seatwatch.config;

import com.bbthechange.seatwatch.service.SeatNotificationTextGenerator;
import com.bbthechange.seatwatch.service.SeatOpeningNotifier;
import com.bbthechange.seatwatch.service.impl.LoggingSeatOpeningNotifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Default notification sink.
 * Auto-configuration runs after the application's own beans are registered, so any
 * {@link SeatOpeningNotifier} bean declared by the application replaces the logging one.
 */
@AutoConfiguration
public class NotificationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SeatOpeningNotifier.class)
    public SeatOpeningNotifier seatOpeningNotifier(SeatNotificationTextGenerator textGenerator) {
        return new LoggingSeatOpeningNotifier(textGenerator);
    }
}
