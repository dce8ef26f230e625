package com.example.realtime.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.UUID;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.realtime.shared.repository")
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "realtime")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        properties.setPodName(StringUtils.hasText(podName) ? podName : "realtime-gateway-" + UUID.randomUUID());
        return properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
