package me.golemcore.engram;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the engram memory engine.
 *
 * <p>
 * The engine keeps an LLM conversation's context bounded by continuously
 * compressing buffered dialogue into compact, scored memory units ("engrams")
 * and by selecting which of them to re-inject into future turns.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound port       → EngramMemoryPort (onMessage, retrieve, cleanup, metrics)
 * Domain Layer       → Consolidation, Retrieval, Decay, Cleanup, Metrics services
 * Outbound adapters  → LLM (langchain4j), JSONL engram store, buffer, lock
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code engram.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EngramApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngramApplication.class, args);
    }

}
