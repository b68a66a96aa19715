/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

/**
 * Encodings a segmentation source can have.
 */
public enum SegmentationFormat {
    /** DICOM Segmentation object with labelled segments. */
    STRUCTURED_LABEL("DICOM SEG"),
    /** DICOM RT Structure Set with planar region contours. */
    REGION_CONTOUR("RTSTRUCT"),
    /** Label volume whose file name names the patient and the referenced series. */
    FILENAME_CONVENTION("NRRD label volume");

    private final String displayName;

    SegmentationFormat(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
