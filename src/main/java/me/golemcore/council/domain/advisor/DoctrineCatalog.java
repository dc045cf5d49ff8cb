package me.golemcore.council.domain.advisor;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.Doctrine;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of doctrines, read once from YAML documents named after the
 * seat they belong to ({@code risk.yaml}, {@code confidant.yaml}, ...).
 */
@Slf4j
public final class DoctrineCatalog {

    private static final String YAML_EXTENSION = ".yaml";

    private final Map<String, Doctrine> doctrines;

    private DoctrineCatalog(Map<String, Doctrine> doctrines) {
        this.doctrines = Collections.unmodifiableMap(new LinkedHashMap<>(doctrines));
    }

    public static DoctrineCatalog of(Map<String, Doctrine> doctrines) {
        Map<String, Doctrine> normalized = new LinkedHashMap<>();
        doctrines.forEach((name, doctrine) -> normalized.put(name.toLowerCase(Locale.ROOT), doctrine));
        return new DoctrineCatalog(normalized);
    }

    public static DoctrineCatalog empty() {
        return new DoctrineCatalog(Map.of());
    }

    /**
     * Load every YAML resource matching {@code locationPattern}. Unreadable
     * documents are skipped; a seat without a doctrine falls back to its own
     * heuristics.
     */
    public static DoctrineCatalog load(String locationPattern) {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to resolve doctrine location " + locationPattern, e);
        }

        Map<String, Doctrine> loaded = new LinkedHashMap<>();
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null || !filename.endsWith(YAML_EXTENSION)) {
                continue;
            }
            String name = filename.substring(0, filename.length() - YAML_EXTENSION.length())
                    .toLowerCase(Locale.ROOT);
            try (InputStream in = resource.getInputStream()) {
                DoctrineDocument document = yamlMapper.readValue(in, DoctrineDocument.class);
                loaded.putIfAbsent(name, document.toDoctrine(name));
            } catch (IOException e) {
                log.warn("[Advisors] Skipping unreadable doctrine {}: {}", filename, e.getMessage());
            }
        }
        log.info("[Advisors] Loaded {} doctrines from {}", loaded.size(), locationPattern);
        return new DoctrineCatalog(loaded);
    }

    public Optional<Doctrine> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(doctrines.get(name.toLowerCase(Locale.ROOT)));
    }

    public Optional<Doctrine> forAdvisor(AdvisorId advisorId) {
        return find(advisorId.key());
    }

    public int size() {
        return doctrines.size();
    }

    @Data
    static class DoctrineDocument {

        private String name;

        @JsonProperty("role_type")
        private String roleType;

        private String purpose;
        private List<String> worldview = new ArrayList<>();
        private List<String> prohibitions = new ArrayList<>();
        private List<String> warnings = new ArrayList<>();

        Doctrine toDoctrine(String fallbackName) {
            return Doctrine.builder()
                    .name(name != null ? name : fallbackName)
                    .roleType(roleType)
                    .purpose(purpose)
                    .worldview(nonBlank(worldview))
                    .prohibitions(nonBlank(prohibitions))
                    .warnings(nonBlank(warnings))
                    .build();
        }

        private static List<String> nonBlank(List<String> values) {
            if (values == null) {
                return List.of();
            }
            return values.stream()
                    .filter(value -> value != null && !value.isBlank())
                    .map(value -> value.trim().toLowerCase(Locale.ROOT))
                    .toList();
        }
    }
}
