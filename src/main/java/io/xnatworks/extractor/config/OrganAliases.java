/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.config;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical organ names and the raw segment labels that map to each of them.
 */
public final class OrganAliases {
    private static final Logger log = LoggerFactory.getLogger(OrganAliases.class);

    private static final TypeReference<LinkedHashMap<String, List<String>>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, Set<String>> aliases;
    private final Map<String, String> canonicalByLabel;

    private OrganAliases(Map<String, ? extends Collection<String>> values) {
        Map<String, Set<String>> aliasMap = new LinkedHashMap<>();
        Map<String, String> reverse = new LinkedHashMap<>();
        values.forEach((organ, labels) -> {
            Set<String> set = new LinkedHashSet<>(labels != null ? labels : List.of());
            for (String label : set) {
                String previous = reverse.putIfAbsent(label, organ);
                if (previous != null && !previous.equals(organ)) {
                    throw new ConfigurationException("Segment label '" + label + "' is an alias of both "
                            + previous + " and " + organ);
                }
            }
            aliasMap.put(organ, Collections.unmodifiableSet(set));
        });
        this.aliases = Collections.unmodifiableMap(aliasMap);
        this.canonicalByLabel = reverse;
    }

    public static OrganAliases of(Map<String, ? extends Collection<String>> values) {
        return new OrganAliases(values != null ? values : Map.of());
    }

    /**
     * Prostate, rectum and bladder, each accepting its own name and the matching
     * {@code Segment_N} label of unnamed segmentations.
     */
    public static OrganAliases defaults() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("Prostate", List.of("Segment_1", "Prostate"));
        values.put("Rectum", List.of("Segment_2", "Rectum"));
        values.put("Bladder", List.of("Segment_3", "Bladder"));
        return of(values);
    }

    /**
     * Load from JSON, or YAML when the name ends in {@code .yaml}/{@code .yml}.
     */
    public static OrganAliases load(Path file) throws IOException {
        log.info("Loading organ aliases from: {}", file.toAbsolutePath());
        Map<String, List<String>> values = MatchCriteria.mapperFor(file).readValue(file.toFile(), MAP_TYPE);
        return of(values);
    }

    public Optional<String> canonicalName(String rawLabel) {
        return Optional.ofNullable(rawLabel != null ? canonicalByLabel.get(rawLabel) : null);
    }

    public List<String> getOrganNames() {
        return new ArrayList<>(aliases.keySet());
    }

    public Set<String> getAliases(String organ) {
        return aliases.getOrDefault(organ, Collections.emptySet());
    }

    public Map<String, Set<String>> toMap() {
        return aliases;
    }

    @Override
    public String toString() {
        return "OrganAliases" + aliases;
    }
}
