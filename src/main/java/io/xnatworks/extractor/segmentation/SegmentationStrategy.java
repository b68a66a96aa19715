/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

/**
 * Reads one segmentation encoding.
 */
public interface SegmentationStrategy {

    SegmentationFormat format();

    /**
     * True when the source has this strategy's encoding. Must not read beyond the header.
     */
    boolean accepts(SegmentationSource source);

    /**
     * Find the referenced series in {@code context} and read every segment onto its grid.
     *
     * @throws SegmentationException when the source is unreadable or its series is not loaded
     */
    RawSegmentation resolve(SegmentationSource source, ResolutionContext context) throws SegmentationException;
}
