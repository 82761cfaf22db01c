package com.chicu.riskwatch.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Console transport: alerts end up in the application log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoggingAlertGateway implements AlertGateway {

    private final NotificationProperties props;

    @Override
    public boolean send(String recipient, String subject, String message) {
        if (!props.isConsoleEnabled()) {
            log.debug("📭 console transport disabled, alert to {} dropped", recipient);
            return false;
        }
        log.info("📨 ALERT to={} subject='{}'\n{}", recipient, subject, message);
        return true;
    }
}
