/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.model.ImageSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The series of a patient that segmentations may reference.
 */
public final class ResolutionContext {

    private final String patientId;
    private final Map<String, ImageSeries> seriesByUid = new LinkedHashMap<>();

    public ResolutionContext(String patientId, Iterable<ImageSeries> series) {
        this.patientId = patientId;
        for (ImageSeries s : series) {
            seriesByUid.putIfAbsent(s.getSeriesInstanceUid(), s);
        }
    }

    public String getPatientId() { return patientId; }

    public ImageSeries getSeries(String seriesUid) {
        return seriesUid != null ? seriesByUid.get(seriesUid) : null;
    }

    /**
     * UIDs in the order the series were given.
     */
    public List<String> getSeriesUids() {
        return Collections.unmodifiableList(new ArrayList<>(seriesByUid.keySet()));
    }
}
