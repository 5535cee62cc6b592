package com.infomedia.abacox.pnrquality.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CachingConfig {

    public static final String QUALITY_SUMMARY = "qualitySummary";
    public static final String DELIVERY_SYSTEMS = "deliverySystems";
    public static final String OFFICES = "offices";

    @Bean
    public CacheManager cacheManager() {
        return new ConcurrentMapCacheManager(QUALITY_SUMMARY, DELIVERY_SYSTEMS, OFFICES);
    }
}
