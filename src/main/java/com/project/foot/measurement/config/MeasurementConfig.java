package com.project.foot.measurement.config;

import com.project.foot.measurement.pipeline.FootMeasurementPipeline;
import com.project.foot.measurement.pipeline.MeasurementParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MeasurementProperties.class)
public class MeasurementConfig {
    private static final Logger log = LoggerFactory.getLogger(MeasurementConfig.class);

    @Bean
    public FootMeasurementPipeline footMeasurementPipeline(MeasurementProperties properties) {
        MeasurementParameters parameters = properties.toParameters();
        log.info("Measurement pipeline configured: {}", parameters);
        return new FootMeasurementPipeline(parameters);
    }
}
