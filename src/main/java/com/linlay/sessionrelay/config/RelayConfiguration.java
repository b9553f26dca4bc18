package com.linlay.sessionrelay.config;

import com.linlay.sessionrelay.stream.service.SseFlushWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RelayConfiguration {

    @Bean
    public SseFlushWriter sseFlushWriter() {
        return new SseFlushWriter();
    }
}
