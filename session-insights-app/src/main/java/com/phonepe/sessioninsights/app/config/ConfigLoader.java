/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sessioninsights.app.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.phonepe.sessioninsights.core.errors.ErrorType;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link SessionInsightsConfig} from YAML
 */
@UtilityClass
@Slf4j
public class ConfigLoader {
    public static final String DEFAULT_CONFIG_RESOURCE = "session-insights.yml";

    private static final YAMLMapper YAML_MAPPER = YAMLMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * @param args Command line arguments. The first one, if present, is the path of a YAML file to use instead of
     *             the bundled defaults.
     */
    public static SessionInsightsConfig load(String... args) {
        if (null != args && args.length > 0) {
            return loadFromYAML(Path.of(args[0]));
        }
        return loadDefaults();
    }

    public static SessionInsightsConfig loadFromYAML(Path path) {
        try {
            log.info("Reading configuration from {}", path);
            return loadFromYAMLContent(Files.readAllBytes(path), path.toString());
        }
        catch (IOException e) {
            throw SessionInsightsException.error(ErrorType.CONFIG_NOT_READABLE, e, path, e.getMessage());
        }
    }

    public static SessionInsightsConfig loadDefaults() {
        try (final var in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (null == in) {
                log.debug("No {} on the classpath, using built in defaults", DEFAULT_CONFIG_RESOURCE);
                return SessionInsightsConfig.builder().build();
            }
            return loadFromYAMLContent(in.readAllBytes(), DEFAULT_CONFIG_RESOURCE);
        }
        catch (IOException e) {
            throw SessionInsightsException.error(ErrorType.CONFIG_NOT_READABLE, e, DEFAULT_CONFIG_RESOURCE,
                                                 e.getMessage());
        }
    }

    static SessionInsightsConfig loadFromYAMLContent(byte[] content, String source) {
        try {
            final var config = YAML_MAPPER.readValue(content, SessionInsightsConfig.class);
            //A document holding only a null maps to null
            return Objects.requireNonNullElseGet(config, () -> SessionInsightsConfig.builder().build());
        }
        catch (IOException e) {
            throw SessionInsightsException.error(ErrorType.CONFIG_NOT_READABLE, e, source, e.getMessage());
        }
    }
}
