package com.keytrader.config;

import com.keytrader.observability.RecentLogBuffer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the buffer filled by the RecentLogAppender declared in logback-spring.xml. */
@Configuration
public class LoggingConfig {

    @Bean
    public RecentLogBuffer recentLogBuffer() {
        return RecentLogBuffer.shared();
    }
}
