/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

import io.xnatworks.extractor.dicom.DicomDataset;
import io.xnatworks.extractor.dicom.DicomTag;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A logical image volume: the slices of one series, ordered along the slice normal.
 *
 * <p>Pixel data is not held here; it is loaded on demand by a volume reader once the
 * series has been matched.</p>
 */
public final class ImageSeries {

    private final String seriesInstanceUid;
    private final String description;
    private final List<Path> files;
    private final Map<String, String> metadata;
    private final DicomDataset header;
    private final ImageGeometry geometry;

    public ImageSeries(String seriesInstanceUid, String description, List<Path> files,
                       Map<String, String> metadata, DicomDataset header, ImageGeometry geometry) {
        this.seriesInstanceUid = seriesInstanceUid;
        this.description = description;
        this.files = List.copyOf(files);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.header = header;
        this.geometry = geometry;
    }

    public String getSeriesInstanceUid() { return seriesInstanceUid; }

    /**
     * Value of the configured match tag, or null when the slices carry none.
     */
    public String getDescription() { return description; }

    public List<Path> getFiles() { return files; }
    public Map<String, String> getMetadata() { return metadata; }

    /**
     * Header of the first slice in spatial order.
     */
    public DicomDataset getHeader() { return header; }

    public ImageGeometry getGeometry() { return geometry; }

    public int[] getShape() {
        return geometry.getShape();
    }

    /**
     * Header value for a DICOM keyword or tag, as it would be copied into the store.
     *
     * @return the value, or null when the tag is unknown or absent
     */
    public String getAttribute(String tagSpec) {
        int tag = DicomTag.parse(tagSpec);
        return tag < 0 ? null : header.getValueAsString(tag);
    }

    @Override
    public String toString() {
        return "ImageSeries{" + description + ", " + seriesInstanceUid + ", " + files.size() + " files}";
    }
}
