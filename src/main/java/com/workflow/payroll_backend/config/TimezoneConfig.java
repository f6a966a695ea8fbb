package com.workflow.payroll_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

@Slf4j
@Configuration
public class TimezoneConfig {

    @Value("${app.timezone:UTC}")
    private String timezone;

    @PostConstruct
    public void init() {
        // approved_at and the audit columns are local timestamps in this zone
        TimeZone.setDefault(TimeZone.getTimeZone(timezone));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }
}
