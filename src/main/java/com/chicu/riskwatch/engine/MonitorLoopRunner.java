package com.chicu.riskwatch.engine;

import com.chicu.riskwatch.monitor.DropoutMonitorService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Registers the monitor jobs and runs the loop on its own daemon thread.
 */
@Slf4j
@Component
@Order(100)
@RequiredArgsConstructor
public class MonitorLoopRunner implements ApplicationRunner {

    public static final String DAILY_JOB = "daily-predictions";
    public static final String QUALITY_JOB = "data-quality";
    public static final String ALERT_JOB = "alert-dispatch";

    private final MonitoringLoop loop;
    private final DropoutMonitorService monitor;
    private final MonitorProperties props;

    private Thread worker;

    @Override
    public void run(ApplicationArguments args) {
        ZoneId zone = ZoneId.of(props.getZone());
        LocalTime dailyAt = LocalTime.parse(props.getDailyAt());

        loop.register(DAILY_JOB, Cadence.daily(dailyAt, zone), monitor::runDailyJob);
        loop.register(QUALITY_JOB, Cadence.every(props.getQualityInterval()), monitor::checkDataQuality);
        loop.register(ALERT_JOB, Cadence.every(props.getAlertDispatchInterval()), monitor::dispatchAlerts);

        if (!props.isEnabled()) {
            log.info("⏸ Monitoring loop disabled (riskwatch.monitor.enabled=false)");
            return;
        }

        worker = new Thread(loop::run, "risk-monitor-loop");
        worker.setDaemon(true);
        worker.start();
        log.info("✅ Monitoring started: daily at {} {}, quality every {}, alerts every {}",
                dailyAt, zone, props.getQualityInterval(), props.getAlertDispatchInterval());
    }

    @PreDestroy
    public void shutdown() {
        loop.stop();
        if (worker != null) {
            log.info("💤 Monitoring loop stopping (current task, if any, runs to completion)");
        }
    }
}
