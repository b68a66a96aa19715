/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.dicom.DicomDataset;

import java.nio.file.Path;

/**
 * A candidate segmentation file. DICOM sources carry the header read while grouping.
 */
public final class SegmentationSource {

    private final Path path;
    private final DicomDataset header;

    private SegmentationSource(Path path, DicomDataset header) {
        this.path = path;
        this.header = header;
    }

    public static SegmentationSource dicom(Path path, DicomDataset header) {
        return new SegmentationSource(path, header);
    }

    public static SegmentationSource file(Path path) {
        return new SegmentationSource(path, null);
    }

    public Path getPath() { return path; }

    /**
     * @return the DICOM header, or null for non-DICOM files
     */
    public DicomDataset getHeader() { return header; }

    public String getFileName() {
        return path.getFileName().toString();
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
