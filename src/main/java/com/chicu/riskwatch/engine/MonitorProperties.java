package com.chicu.riskwatch.engine;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "riskwatch.monitor")
public class MonitorProperties {

    /** Start the background loop at application start-up. */
    private boolean enabled = true;

    /** HH:mm, local time in {@link #zone}. */
    private String dailyAt = "02:00";
    private String zone = "UTC";

    private Duration qualityInterval = Duration.ofHours(1);
    private Duration alertDispatchInterval = Duration.ofMinutes(1);
    private Duration pollInterval = Duration.ofMinutes(1);

    /** How far back the daily job looks for updated records. */
    private Duration lookback = Duration.ofDays(1);
}
