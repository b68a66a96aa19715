/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

import java.util.Collections;
import java.util.Map;

/**
 * One matched series of a patient record: its criterion, image and optional organ masks.
 */
public final class RecordEntry {

    private final String criterion;
    private final ImageSeries series;
    private final Volume image;
    private final Segmentation segmentation;

    public RecordEntry(String criterion, ImageSeries series, Volume image, Segmentation segmentation) {
        this.criterion = criterion;
        this.series = series;
        this.image = image;
        this.segmentation = segmentation;
    }

    public String getCriterion() { return criterion; }
    public ImageSeries getSeries() { return series; }
    public Volume getImage() { return image; }

    /**
     * @return the segmentation, or null when the series has none
     */
    public Segmentation getSegmentation() { return segmentation; }

    public boolean hasSegmentation() {
        return segmentation != null;
    }

    public Map<String, Mask> getMasks() {
        return segmentation != null ? segmentation.getOrgans() : Collections.emptyMap();
    }

    public RecordEntry withData(Volume newImage, Segmentation newSegmentation) {
        return new RecordEntry(criterion, series, newImage, newSegmentation);
    }
}
