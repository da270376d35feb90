package com.tabletop.config;

import com.tabletop.module.RandomSource;
import com.tabletop.module.SecureRandomSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class EngineConfig {

    @Bean
    public RandomSource randomSource() {
        return new SecureRandomSource();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder().build();
    }
}
