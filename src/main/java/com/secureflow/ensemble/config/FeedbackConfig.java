package com.secureflow.ensemble.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "ensemble.feedback")
public class FeedbackConfig {
    private boolean enabled = true;
    private int tuningIntervalMinutes = 60;
    private int minSamplesForTuning = 50;
}
