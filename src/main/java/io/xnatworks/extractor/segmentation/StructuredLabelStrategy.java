/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.dicom.DicomDataset;
import io.xnatworks.extractor.dicom.DicomFileReader;
import io.xnatworks.extractor.dicom.DicomTag;
import io.xnatworks.extractor.dicom.PixelDataDecoder;
import io.xnatworks.extractor.dicom.SopClass;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.ImageSeries;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads DICOM Segmentation objects.
 *
 * <p>The referenced series comes from the first item of the Referenced Series Sequence.
 * Each frame belongs to the segment named in its Segment Identification Sequence and is
 * placed by its Plane Position, so frames on a grid other than the series' are mapped
 * voxel by voxel. Frames without a position fill the series' slices in frame order.
 * Binary and fractional segmentations are read; any non-zero fractional value counts as
 * inside.</p>
 */
public class StructuredLabelStrategy implements SegmentationStrategy {
    private static final Logger log = LoggerFactory.getLogger(StructuredLabelStrategy.class);

    @Override
    public SegmentationFormat format() {
        return SegmentationFormat.STRUCTURED_LABEL;
    }

    @Override
    public boolean accepts(SegmentationSource source) {
        return source.getHeader() != null && SopClass.isSegmentation(source.getHeader());
    }

    @Override
    public RawSegmentation resolve(SegmentationSource source, ResolutionContext context) throws SegmentationException {
        DicomDataset dataset;
        try {
            dataset = DicomFileReader.read(source.getPath());
        } catch (IOException e) {
            throw new SegmentationException(FailureReason.UNREADABLE_SEGMENTATION,
                    "Cannot read " + source.getFileName() + ": " + e.getMessage(), e);
        }

        String seriesUid = referencedSeriesUid(dataset);
        if (seriesUid == null) {
            throw new SegmentationException(FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE,
                    source.getFileName() + " has no Referenced Series Sequence");
        }
        ImageSeries target = context.getSeries(seriesUid);
        if (target == null) {
            throw new SegmentationException(FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE,
                    source.getFileName() + " references series " + seriesUid + " which is not loaded");
        }
        ImageGeometry geometry = target.getGeometry();

        Map<Integer, String> labels = segmentLabels(dataset);
        if (labels.isEmpty()) {
            throw new SegmentationException(FailureReason.UNREADABLE_SEGMENTATION,
                    source.getFileName() + " declares no segments");
        }

        float[] pixels;
        try {
            pixels = PixelDataDecoder.decode(dataset, false);
        } catch (IOException e) {
            throw new SegmentationException(FailureReason.UNREADABLE_SEGMENTATION,
                    "Cannot decode frames of " + source.getFileName() + ": " + e.getMessage(), e);
        }

        int rows = dataset.getInt(DicomTag.Rows, 0);
        int columns = dataset.getInt(DicomTag.Columns, 0);
        int frames = PixelDataDecoder.frameCount(dataset);
        int frameSize = rows * columns;

        Map<Integer, Mask> masks = new LinkedHashMap<>();
        for (Integer number : labels.keySet()) {
            masks.put(number, Mask.empty(geometry));
        }
        Map<Integer, Integer> framesPerSegment = new HashMap<>();

        DicomDataset shared = dataset.getNestedDataset(DicomTag.SharedFunctionalGroupsSequence);
        List<DicomDataset> perFrame = dataset.getSequence(DicomTag.PerFrameFunctionalGroupsSequence);

        for (int f = 0; f < frames; f++) {
            DicomDataset frameGroup = f < perFrame.size() ? perFrame.get(f) : null;
            int segmentNumber = segmentNumber(frameGroup, shared, labels);
            Mask mask = masks.get(segmentNumber);
            if (mask == null) {
                log.warn("{}: frame {} references unknown segment {}, skipped", source.getFileName(), f + 1, segmentNumber);
                continue;
            }
            int frameIndex = framesPerSegment.merge(segmentNumber, 1, Integer::sum) - 1;

            DicomDataset position = functionalItem(frameGroup, shared, DicomTag.PlanePositionSequence);
            double[] origin = position != null ? position.getDoubles(DicomTag.ImagePositionPatient) : new double[0];
            if (origin.length == 3) {
                placeFrame(pixels, f * frameSize, rows, columns, origin,
                        frameOrientation(frameGroup, shared, geometry),
                        framePixelSpacing(frameGroup, shared, geometry), mask);
            } else if (rows == geometry.getRows() && columns == geometry.getColumns()
                    && frameIndex < geometry.getSlices()) {
                byte[] data = mask.getData();
                int offset = frameIndex * frameSize;
                for (int p = 0; p < frameSize; p++) {
                    if (pixels[f * frameSize + p] > 0) {
                        data[offset + p] = 1;
                    }
                }
            } else {
                log.warn("{}: frame {} has no position and does not fit the series grid, skipped",
                        source.getFileName(), f + 1);
            }
        }

        List<Segment> segments = new ArrayList<>();
        labels.forEach((number, label) -> segments.add(new Segment(label, masks.get(number))));
        return new RawSegmentation(seriesUid, segments, source.getPath(), format());
    }

    static String referencedSeriesUid(DicomDataset dataset) {
        DicomDataset item = dataset.getNestedDataset(DicomTag.ReferencedSeriesSequence);
        return item != null ? item.getString(DicomTag.SeriesInstanceUID) : null;
    }

    /**
     * Segment number to label: Segment Label, else Segment Description, else {@code Segment_N}.
     */
    static Map<Integer, String> segmentLabels(DicomDataset dataset) {
        Map<Integer, String> labels = new LinkedHashMap<>();
        for (DicomDataset item : dataset.getSequence(DicomTag.SegmentSequence)) {
            int number = item.getInt(DicomTag.SegmentNumber, labels.size() + 1);
            String label = item.getString(DicomTag.SegmentLabel);
            if (label == null) {
                label = item.getString(DicomTag.SegmentDescription);
            }
            if (label == null) {
                label = "Segment_" + number;
            }
            labels.put(number, label);
        }
        return labels;
    }

    private static int segmentNumber(DicomDataset frameGroup, DicomDataset shared, Map<Integer, String> labels) {
        DicomDataset identification = functionalItem(frameGroup, shared, DicomTag.SegmentIdentificationSequence);
        if (identification != null && identification.contains(DicomTag.ReferencedSegmentNumber)) {
            return identification.getInt(DicomTag.ReferencedSegmentNumber, -1);
        }
        return labels.size() == 1 ? labels.keySet().iterator().next() : -1;
    }

    private static DicomDataset functionalItem(DicomDataset frameGroup, DicomDataset shared, int sequenceTag) {
        DicomDataset item = frameGroup != null ? frameGroup.getNestedDataset(sequenceTag) : null;
        if (item == null && shared != null) {
            item = shared.getNestedDataset(sequenceTag);
        }
        return item;
    }

    private static double[] frameOrientation(DicomDataset frameGroup, DicomDataset shared, ImageGeometry geometry) {
        DicomDataset item = functionalItem(frameGroup, shared, DicomTag.PlaneOrientationSequence);
        double[] orientation = item != null ? item.getDoubles(DicomTag.ImageOrientationPatient) : new double[0];
        if (orientation.length == 6) {
            return orientation;
        }
        double[] d = geometry.getDirection();
        return new double[]{d[0], d[3], d[6], d[1], d[4], d[7]};
    }

    /**
     * Row spacing, then column spacing, as in Pixel Spacing.
     */
    private static double[] framePixelSpacing(DicomDataset frameGroup, DicomDataset shared, ImageGeometry geometry) {
        DicomDataset item = functionalItem(frameGroup, shared, DicomTag.PixelMeasuresSequence);
        double[] spacing = item != null ? item.getDoubles(DicomTag.PixelSpacing) : new double[0];
        if (spacing.length == 2) {
            return spacing;
        }
        double[] s = geometry.getSpacing();
        return new double[]{s[1], s[0]};
    }

    private static void placeFrame(float[] pixels, int offset, int rows, int columns, double[] origin,
                                   double[] orientation, double[] pixelSpacing, Mask mask) {
        ImageGeometry geometry = mask.getGeometry();
        double[] base = geometry.physicalToIndex(origin);
        double[] alongRow = geometry.physicalToIndex(new double[]{
                origin[0] + orientation[0] * pixelSpacing[1],
                origin[1] + orientation[1] * pixelSpacing[1],
                origin[2] + orientation[2] * pixelSpacing[1]});
        double[] alongColumn = geometry.physicalToIndex(new double[]{
                origin[0] + orientation[3] * pixelSpacing[0],
                origin[1] + orientation[4] * pixelSpacing[0],
                origin[2] + orientation[5] * pixelSpacing[0]});

        byte[] data = mask.getData();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                if (pixels[offset + r * columns + c] <= 0) {
                    continue;
                }
                int i = Resampler.nearest(base[0] + c * (alongRow[0] - base[0]) + r * (alongColumn[0] - base[0]));
                int j = Resampler.nearest(base[1] + c * (alongRow[1] - base[1]) + r * (alongColumn[1] - base[1]));
                int k = Resampler.nearest(base[2] + c * (alongRow[2] - base[2]) + r * (alongColumn[2] - base[2]));
                if (geometry.contains(i, j, k)) {
                    data[geometry.index(i, j, k)] = 1;
                }
            }
        }
    }
}
