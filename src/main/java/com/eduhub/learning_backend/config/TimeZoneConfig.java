package com.eduhub.learning_backend.config;

import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.TimeZone;

/**
 * 强制统一为 UTC：账期（YYYY-MM）的起止边界与订阅有效期比较都按 UTC 计算，避免部署时区差异导致跨月错位。
 */
@Configuration
public class TimeZoneConfig {

    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(ZoneOffset.UTC));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
