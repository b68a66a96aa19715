/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Organ masks of one image series, keyed by canonical organ name.
 */
public final class Segmentation {

    private final String referencedSeriesUid;
    private final Map<String, Mask> organs;
    private final List<Path> sources;

    public Segmentation(String referencedSeriesUid, Map<String, Mask> organs, List<Path> sources) {
        this.referencedSeriesUid = referencedSeriesUid;
        this.organs = Collections.unmodifiableMap(new LinkedHashMap<>(organs));
        this.sources = List.copyOf(sources);
    }

    public String getReferencedSeriesUid() { return referencedSeriesUid; }
    public Map<String, Mask> getOrgans() { return organs; }
    public List<Path> getSources() { return sources; }

    public Mask getMask(String organ) {
        return organs.get(organ);
    }

    public boolean isEmpty() {
        return organs.isEmpty();
    }

    /**
     * Combine two segmentations of the same series. Organs present in both are OR-ed.
     */
    public Segmentation merge(Segmentation other) {
        if (!referencedSeriesUid.equals(other.referencedSeriesUid)) {
            throw new IllegalArgumentException("Cannot merge segmentations of series "
                    + referencedSeriesUid + " and " + other.referencedSeriesUid);
        }
        Map<String, Mask> merged = new LinkedHashMap<>(organs);
        other.organs.forEach((organ, mask) -> merged.merge(organ, mask, Mask::or));
        List<Path> allSources = new ArrayList<>(sources);
        allSources.addAll(other.sources);
        return new Segmentation(referencedSeriesUid, merged, allSources);
    }

    @Override
    public String toString() {
        return "Segmentation{" + referencedSeriesUid + ", organs=" + organs.keySet() + "}";
    }
}
