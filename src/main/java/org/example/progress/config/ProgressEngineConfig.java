package org.example.progress.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(ProgressEngineProperties.class)
public class ProgressEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ProgressEngineConfig.class);

    @Bean
    public Clock progressClock(ProgressEngineProperties properties) {
        ZoneId zone = ZoneId.of(properties.getZoneId());
        log.info("Configuring progress clock: zone={}, playbackSpeed={}..{} (default {})",
                zone,
                properties.getMinPlaybackSpeed(),
                properties.getMaxPlaybackSpeed(),
                properties.getDefaultPlaybackSpeed());
        return Clock.system(zone);
    }
}
