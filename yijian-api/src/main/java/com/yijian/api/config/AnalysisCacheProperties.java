package com.yijian.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "yijian.analysis-cache")
@Getter
@Setter
public class AnalysisCacheProperties {
    private boolean enabled = false;
    private int ttlMinutes = 60;
    private int maxEntries = 500;
}
