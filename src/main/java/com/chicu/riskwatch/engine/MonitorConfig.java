package com.chicu.riskwatch.engine;

import com.chicu.riskwatch.notification.NotificationProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        MonitorProperties.class,
        NotificationProperties.class
})
public class MonitorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public MonitoringLoop monitoringLoop(Clock clock, Sleeper sleeper, MonitorProperties props) {
        return new MonitoringLoop(clock, sleeper, props.getPollInterval());
    }
}
