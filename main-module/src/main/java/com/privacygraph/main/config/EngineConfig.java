package com.privacygraph.main.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.privacygraph.common.serialization.PropertiesCodec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PrivacyGraphProperties.class)
public class EngineConfig {

    @Bean
    public PropertiesCodec propertiesCodec(ObjectMapper objectMapper) {
        return new PropertiesCodec(objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
