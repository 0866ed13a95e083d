/*
 * Copyright 2025 Sachin Nimbal
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
 */

package io.github.sachinnimbal.filmes.core.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(FilmesProperties.class)
public class FilmesConfiguration {

    public FilmesConfiguration(FilmesProperties properties) {
        validatePagination(properties.getPagination());

        log.info("========================================");
        log.info("  Filmes API");
        log.info("  storage: {} | page size: {} (max {}) | base path: {}",
                properties.getStorage().getType(),
                properties.getPagination().getDefaultPageSize(),
                properties.getPagination().getMaxPageSize(),
                properties.getApi().getBasePath());
        log.info("========================================");
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private void validatePagination(FilmesProperties.Pagination pagination) {
        if (pagination.getDefaultPageSize() < 1) {
            throw new IllegalStateException(
                    "filmes.pagination.default-page-size must be at least 1, was " + pagination.getDefaultPageSize());
        }
        if (pagination.getMaxPageSize() < pagination.getDefaultPageSize()) {
            throw new IllegalStateException(String.format(
                    "filmes.pagination.max-page-size (%d) must not be smaller than default-page-size (%d)",
                    pagination.getMaxPageSize(), pagination.getDefaultPageSize()));
        }
    }
}
