package me.golemcore.engram.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that provides shared infrastructure beans and validates
 * the engine configuration on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and {@link ObjectMapper} beans</li>
 * <li>Fails startup on invalid {@code engram.*} settings</li>
 * <li>Logs the effective thresholds</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final EngramProperties properties;
    private final EngramPropertiesValidator validator;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        validator.validate(properties);

        var consolidation = properties.getConsolidation();
        log.info("Engram engine {}", properties.isEnabled() ? "enabled" : "disabled");
        log.info("Consolidation: chunk={} tokens, minMessages={}, surpriseThreshold={}",
                consolidation.getChunkSizeTokens(), consolidation.getMinMessagesForEngram(),
                consolidation.getSurpriseThreshold());
        log.info("Decay: rate={}/day, boost={}, maxRelevance={}",
                properties.getDecay().getDecayRate(), properties.getDecay().getReinforcementBoost(),
                properties.getDecay().getMaxRelevance());
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
    }
}
