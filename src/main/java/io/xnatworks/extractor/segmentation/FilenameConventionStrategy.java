/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.locate.SegmentationFilenameMatcher;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.ImageSeries;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.Segment;
import io.xnatworks.extractor.nrrd.NrrdFile;
import io.xnatworks.extractor.nrrd.NrrdReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reads NRRD label volumes whose file name contains the UID of the series they belong to.
 *
 * <p>Slicer segmentation files name their segments in the header
 * ({@code Segment0_Name}, {@code Segment0_LabelValue}, {@code Segment0_Layer}). Plain label
 * maps yield one {@code Segment_N} per distinct non-zero label N. The volume is resampled
 * onto the series grid with nearest-neighbour interpolation.</p>
 */
public class FilenameConventionStrategy implements SegmentationStrategy {
    private static final Logger log = LoggerFactory.getLogger(FilenameConventionStrategy.class);

    private final SegmentationFilenameMatcher filenameMatcher;

    public FilenameConventionStrategy(SegmentationFilenameMatcher filenameMatcher) {
        this.filenameMatcher = filenameMatcher;
    }

    @Override
    public SegmentationFormat format() {
        return SegmentationFormat.FILENAME_CONVENTION;
    }

    @Override
    public boolean accepts(SegmentationSource source) {
        return source.getHeader() == null && NrrdReader.isNrrdFile(source.getPath());
    }

    @Override
    public RawSegmentation resolve(SegmentationSource source, ResolutionContext context) throws SegmentationException {
        List<String> referenced = filenameMatcher.referencedSeries(source.getFileName(), context.getSeriesUids());
        if (referenced.isEmpty()) {
            throw new SegmentationException(FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE,
                    source.getFileName() + " contains no loaded series UID");
        }
        String seriesUid = referenced.get(0);
        ImageSeries target = context.getSeries(seriesUid);

        NrrdFile nrrd;
        ImageGeometry sourceGeometry;
        try {
            nrrd = NrrdReader.read(source.getPath());
            sourceGeometry = nrrd.getGeometry();
        } catch (IOException e) {
            throw new SegmentationException(FailureReason.UNREADABLE_SEGMENTATION,
                    "Cannot read " + source.getFileName() + ": " + e.getMessage(), e);
        }
        ImageGeometry targetGeometry = target.getGeometry();

        Map<Integer, int[]> resampledLayers = new HashMap<>();
        List<Segment> segments = new ArrayList<>();
        if (nrrd.hasSegmentMetadata()) {
            for (NrrdFile.SegmentInfo info : nrrd.getSegments()) {
                if (info.getLayer() < 0 || info.getLayer() >= nrrd.getLayerCount()) {
                    throw new SegmentationException(FailureReason.UNREADABLE_SEGMENTATION,
                            source.getFileName() + ": segment " + info.getName() + " is on missing layer " + info.getLayer());
                }
                int[] labels = resampledLayers.computeIfAbsent(info.getLayer(),
                        layer -> Resampler.resampleLabels(sourceGeometry, nrrd.getLayer(layer), targetGeometry));
                segments.add(new Segment(info.getName(), maskOf(labels, info.getLabelValue(), targetGeometry)));
            }
        } else {
            if (nrrd.getLayerCount() > 1) {
                log.warn("{} has {} layers but no segment names, reading the first layer only",
                        source.getFileName(), nrrd.getLayerCount());
            }
            int[] raw = nrrd.getLayer(0);
            TreeSet<Integer> values = new TreeSet<>();
            for (int value : raw) {
                if (value != 0) {
                    values.add(value);
                }
            }
            int[] labels = Resampler.resampleLabels(sourceGeometry, raw, targetGeometry);
            for (int value : values) {
                segments.add(new Segment("Segment_" + value, maskOf(labels, value, targetGeometry)));
            }
        }
        return new RawSegmentation(seriesUid, segments, source.getPath(), format());
    }

    private static Mask maskOf(int[] labels, int value, ImageGeometry geometry) {
        byte[] data = new byte[labels.length];
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == value) {
                data[i] = 1;
            }
        }
        return new Mask(geometry, data);
    }
}
