package com.chicu.riskwatch.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "riskwatch.notification")
public class NotificationProperties {
    private String alertRecipient = "mentor@school.edu";
    private String summaryRecipient = "admin@school.edu";
    private String alertSubject = "Student Dropout Risk Alert";
    private String summarySubject = "Daily Dropout Prediction Summary";

    /** Log transport on/off. With it off nothing is delivered and alerts are recorded as FAILED. */
    private boolean consoleEnabled = true;
}
