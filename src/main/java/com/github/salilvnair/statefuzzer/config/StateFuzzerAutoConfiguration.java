package com.github.salilvnair.statefuzzer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.statefuzzer")
public class StateFuzzerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper stateFuzzerObjectMapper() {
        return new ObjectMapper();
    }
}
