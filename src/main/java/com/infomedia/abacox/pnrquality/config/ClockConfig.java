package com.infomedia.abacox.pnrquality.config;

import com.infomedia.abacox.pnrquality.component.configmanager.ConfigKey;
import com.infomedia.abacox.pnrquality.component.configmanager.ConfigService;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Log4j2
@Configuration
public class ClockConfig {

    /**
     * Clock in the reporting time zone; "today" of the daily trend is read from it.
     */
    @Bean
    public Clock clock(ConfigService configService) {
        ZoneId zone = configService.getValue(ConfigKey.TIME_ZONE).asZoneId();
        log.info("Reporting time zone: {}", zone);
        return Clock.system(zone);
    }
}
