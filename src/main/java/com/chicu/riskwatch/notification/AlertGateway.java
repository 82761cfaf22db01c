package com.chicu.riskwatch.notification;

/**
 * Outbound alert transport. Best effort: {@code false} means "not delivered", never an exception.
 */
public interface AlertGateway {

    boolean send(String recipient, String subject, String message);
}
