/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.model.Segment;

import java.nio.file.Path;
import java.util.List;

/**
 * Segments read from one source, already on the grid of the series they reference,
 * with their labels as written in the source.
 */
public final class RawSegmentation {

    private final String referencedSeriesUid;
    private final List<Segment> segments;
    private final Path source;
    private final SegmentationFormat format;

    public RawSegmentation(String referencedSeriesUid, List<Segment> segments, Path source, SegmentationFormat format) {
        this.referencedSeriesUid = referencedSeriesUid;
        this.segments = List.copyOf(segments);
        this.source = source;
        this.format = format;
    }

    public String getReferencedSeriesUid() { return referencedSeriesUid; }
    public List<Segment> getSegments() { return segments; }
    public Path getSource() { return source; }
    public SegmentationFormat getFormat() { return format; }
}
