/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
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
 * Dictionary of match criteria: criterion name to the ordered set of series descriptions
 * it accepts (e.g. {@code CT -> ["CT 3mm", "CT abdomen"]}).
 *
 * <p>One instance is shared by every patient of a run. It only grows through
 * {@link #accept(String, String)}, which is called explicitly by whoever confirms that a
 * description belongs to a criterion. All methods are thread-safe. Parallel callers may
 * instead work on a {@link #snapshot()} and reconcile it with {@link #mergeFrom(MatchCriteria)}.</p>
 *
 * <p>A description may belong to at most one criterion.</p>
 */
public class MatchCriteria {
    private static final Logger log = LoggerFactory.getLogger(MatchCriteria.class);

    private static final TypeReference<LinkedHashMap<String, List<String>>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, LinkedHashSet<String>> criteria = new LinkedHashMap<>();

    public MatchCriteria() {
    }

    /**
     * @throws ConfigurationException if a description appears under two criteria
     */
    public static MatchCriteria of(Map<String, ? extends Collection<String>> values) {
        MatchCriteria result = new MatchCriteria();
        if (values != null) {
            values.forEach((name, descriptions) -> result.addAll(name, descriptions));
        }
        return result;
    }

    /**
     * Load a dictionary from a JSON file, or YAML when the name ends in {@code .yaml}/{@code .yml}.
     */
    public static MatchCriteria load(Path file) throws IOException {
        log.info("Loading match criteria from: {}", file.toAbsolutePath());
        if (Files.size(file) == 0) {
            return new MatchCriteria();
        }
        Map<String, List<String>> values = mapperFor(file).readValue(file.toFile(), MAP_TYPE);
        return of(values);
    }

    public void save(Path file) throws IOException {
        Map<String, List<String>> values = toMap();
        log.info("Saving match criteria ({} criteria) to: {}", values.size(), file.toAbsolutePath());
        mapperFor(file).writerWithDefaultPrettyPrinter().writeValue(file.toFile(), values);
    }

    static ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".yaml") || name.endsWith(".yml") ? new ObjectMapper(new YAMLFactory()) : new ObjectMapper();
    }

    /**
     * True when no criterion is configured, which disables description filtering.
     */
    public synchronized boolean isEmpty() {
        return criteria.isEmpty();
    }

    public synchronized List<String> getNames() {
        return new ArrayList<>(criteria.keySet());
    }

    public synchronized boolean contains(String name) {
        return criteria.containsKey(name);
    }

    public synchronized Set<String> getDescriptions(String name) {
        Set<String> descriptions = criteria.get(name);
        return descriptions != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(descriptions))
                : Collections.emptySet();
    }

    /**
     * Criterion accepting exactly this description. No case or whitespace normalization.
     */
    public synchronized Optional<String> findCriterion(String description) {
        if (description == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, LinkedHashSet<String>> entry : criteria.entrySet()) {
            if (entry.getValue().contains(description)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Append a description to a criterion's accepted set.
     *
     * @return the criterion's accepted descriptions after the change
     * @throws IllegalArgumentException if the criterion is unknown or the description
     *                                  already belongs to another criterion
     */
    public synchronized Set<String> accept(String name, String description) {
        LinkedHashSet<String> descriptions = criteria.get(name);
        if (descriptions == null) {
            throw new IllegalArgumentException("Unknown criterion: " + name);
        }
        Optional<String> owner = findCriterion(description);
        if (owner.isPresent() && !owner.get().equals(name)) {
            throw new IllegalArgumentException("Description '" + description
                    + "' already belongs to criterion " + owner.get());
        }
        if (descriptions.add(description)) {
            log.info("Added description '{}' to criterion {}", description, name);
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(descriptions));
    }

    public synchronized MatchCriteria snapshot() {
        return of(toMap());
    }

    /**
     * Add every description of {@code other} to this dictionary, creating missing criteria.
     *
     * @throws ConfigurationException if the two dictionaries assign a description to different criteria
     */
    public void mergeFrom(MatchCriteria other) {
        Map<String, List<String>> values = other.toMap();
        synchronized (this) {
            values.forEach(this::addAll);
        }
    }

    public synchronized Map<String, List<String>> toMap() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        criteria.forEach((name, descriptions) -> values.put(name, new ArrayList<>(descriptions)));
        return values;
    }

    private synchronized void addAll(String name, Collection<String> descriptions) {
        LinkedHashSet<String> target = criteria.computeIfAbsent(name, n -> new LinkedHashSet<>());
        if (descriptions == null) {
            return;
        }
        for (String description : descriptions) {
            Optional<String> owner = findCriterion(description);
            if (owner.isPresent() && !owner.get().equals(name)) {
                throw new ConfigurationException("Description '" + description + "' is listed under both "
                        + owner.get() + " and " + name);
            }
            target.add(description);
        }
    }

    @Override
    public synchronized String toString() {
        return "MatchCriteria" + criteria;
    }
}
