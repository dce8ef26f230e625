package com.example.realtime.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables scheduling for every profile except 'test', where sweeps are driven by hand.
 */
@Configuration
@EnableScheduling
@Profile("!test")
public class SchedulingConditionalConfig {
}
