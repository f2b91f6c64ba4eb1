package com.iot.diagnostics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iot.common.util.JsonUtil;
import org.springframework.boot.web.codec.CodecCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonEncoder;

/**
 * HTTP responses are written with the mapper the command-line adapter prints
 * with, so both modes emit the same JSON. Batch bodies arrive as raw strings
 * and are parsed by {@code BatchReader}, so no decoder is registered.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Bean
    public CodecCustomizer diagnosticsResponseEncoder(ObjectMapper objectMapper) {
        return configurer -> configurer.defaultCodecs()
                .jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper, MediaType.APPLICATION_JSON));
    }
}
