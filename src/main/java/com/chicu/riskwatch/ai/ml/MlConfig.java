package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.ai.persistence.MlStorageProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        MlStorageProperties.class,
        MlModelProperties.class,
        MlLifecycleProperties.class
})
public class MlConfig {

    @Bean
    public RiskBandThresholds riskBandThresholds(MlModelProperties props) {
        return new RiskBandThresholds(props.getMediumRiskFrom(), props.getHighRiskFrom());
    }
}
