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

import io.github.sachinnimbal.filmes.storage.MovieStore;
import io.github.sachinnimbal.filmes.storage.jpa.JpaMovieStore;
import io.github.sachinnimbal.filmes.storage.memory.InMemoryMovieStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the {@link MovieStore} backend from {@code filmes.storage.type}.
 */
@Slf4j
@Configuration
public class FilmesStorageConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "filmes.storage", name = "type", havingValue = "memory", matchIfMissing = true)
    public MovieStore inMemoryMovieStore() {
        log.info("✓ Movie storage: in-memory");
        return new InMemoryMovieStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "filmes.storage", name = "type", havingValue = "jpa")
    public MovieStore jpaMovieStore() {
        log.info("✓ Movie storage: JPA (spring.datasource)");
        return new JpaMovieStore();
    }
}
