/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.match;

import io.xnatworks.extractor.model.ImageSeries;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which series of a patient were accepted, and under which criterion.
 */
public class MatchSelection {

    private final Map<String, ImageSeries> matched = new LinkedHashMap<>();
    private final List<ImageSeries> duplicates = new ArrayList<>();
    private final List<ImageSeries> unmatched = new ArrayList<>();
    private final List<String> missingCriteria = new ArrayList<>();
    private final List<String> availableDescriptions = new ArrayList<>();

    /**
     * Accepted series by criterion name, in criterion order.
     */
    public Map<String, ImageSeries> getMatched() { return matched; }

    /**
     * Series that matched a criterion already taken by an earlier series.
     */
    public List<ImageSeries> getDuplicates() { return duplicates; }

    public List<ImageSeries> getUnmatched() { return unmatched; }

    /**
     * Configured criteria that no series satisfied.
     */
    public List<String> getMissingCriteria() { return missingCriteria; }

    /**
     * Distinct descriptions of all the patient's series, in series order.
     */
    public List<String> getAvailableDescriptions() { return availableDescriptions; }

    public boolean isEmpty() {
        return matched.isEmpty();
    }
}
