package com.phillippitts.voicechat.config;

import com.phillippitts.voicechat.service.realtime.transport.InMemoryRealtimeTransport;
import com.phillippitts.voicechat.service.realtime.transport.RealtimeTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Transport wiring. Setting {@code realtime.transport.type} to anything other than
 * {@code in-memory} disables the in-process transport so another {@link RealtimeTransport}
 * bean can be supplied.
 */
@Configuration
public class RealtimeConfig {

    private static final Logger LOG = LogManager.getLogger(RealtimeConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "realtime.transport", name = "type", havingValue = "in-memory",
            matchIfMissing = true)
    public InMemoryRealtimeTransport inMemoryRealtimeTransport() {
        LOG.info("Using in-process realtime transport");
        return new InMemoryRealtimeTransport();
    }
}
