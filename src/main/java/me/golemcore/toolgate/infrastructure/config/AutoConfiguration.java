package me.golemcore.toolgate.infrastructure.config;

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
import me.golemcore.toolgate.domain.catalog.CapabilityCatalog;
import me.golemcore.toolgate.domain.service.AccessPolicy;
import me.golemcore.toolgate.domain.service.ToolRegistry;
import me.golemcore.toolgate.port.outbound.DesktopLane;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup wiring.
 *
 * <p>
 * Attaches the desktop lane to the registry when one is present. Without a lane
 * desktop tools run inline.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ToolRegistry toolRegistry;
    private final CapabilityCatalog capabilityCatalog;
    private final AccessPolicy accessPolicy;
    private final ObjectProvider<DesktopLane> desktopLaneProvider;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
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
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Toolgate v{} starting...", version);
        log.info("Platform: {}", capabilityCatalog.platform().wireName());
        log.info("Access level: {}, ask mode: {}", accessPolicy.getLevel(), accessPolicy.getAskMode());

        DesktopLane lane = desktopLaneProvider.getIfAvailable();
        if (lane != null) {
            toolRegistry.attachDesktopLane(lane);
        } else {
            log.info("Desktop lane disabled, desktop tools run inline");
        }
        log.info("Tools: {}", toolRegistry.names());
    }
}
