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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads RT Structure Sets and rasterizes each ROI onto the referenced series.
 *
 * <p>The series is found through Referenced Frame of Reference, RT Referenced Study and
 * RT Referenced Series. Closed planar contours are assigned to the nearest slice and
 * filled with the even-odd rule; single points mark their voxel; open contours are
 * ignored.</p>
 */
public class RegionContourStrategy implements SegmentationStrategy {
    private static final Logger log = LoggerFactory.getLogger(RegionContourStrategy.class);

    @Override
    public SegmentationFormat format() {
        return SegmentationFormat.REGION_CONTOUR;
    }

    @Override
    public boolean accepts(SegmentationSource source) {
        return source.getHeader() != null && SopClass.isStructureSet(source.getHeader());
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
                    source.getFileName() + " has no referenced series");
        }
        ImageSeries target = context.getSeries(seriesUid);
        if (target == null) {
            throw new SegmentationException(FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE,
                    source.getFileName() + " references series " + seriesUid + " which is not loaded");
        }
        ImageGeometry geometry = target.getGeometry();

        Map<Integer, String> names = new LinkedHashMap<>();
        for (DicomDataset roi : dataset.getSequence(DicomTag.StructureSetROISequence)) {
            int number = roi.getInt(DicomTag.ROINumber, -1);
            names.put(number, roi.getString(DicomTag.ROIName, "ROI_" + number));
        }

        Map<Integer, List<DicomDataset>> contoursByRoi = new LinkedHashMap<>();
        for (DicomDataset roiContour : dataset.getSequence(DicomTag.ROIContourSequence)) {
            int number = roiContour.getInt(DicomTag.ReferencedROINumber, -1);
            contoursByRoi.computeIfAbsent(number, n -> new ArrayList<>())
                    .addAll(roiContour.getSequence(DicomTag.ContourSequence));
            names.putIfAbsent(number, "ROI_" + number);
        }

        List<Segment> segments = new ArrayList<>();
        for (Map.Entry<Integer, String> roi : names.entrySet()) {
            List<DicomDataset> contours = contoursByRoi.getOrDefault(roi.getKey(), List.of());
            segments.add(new Segment(roi.getValue(), rasterize(roi.getValue(), contours, geometry)));
        }
        return new RawSegmentation(seriesUid, segments, source.getPath(), format());
    }

    static String referencedSeriesUid(DicomDataset dataset) {
        for (DicomDataset frame : dataset.getSequence(DicomTag.ReferencedFrameOfReferenceSequence)) {
            for (DicomDataset study : frame.getSequence(DicomTag.RTReferencedStudySequence)) {
                for (DicomDataset series : study.getSequence(DicomTag.RTReferencedSeriesSequence)) {
                    String uid = series.getString(DicomTag.SeriesInstanceUID);
                    if (uid != null) {
                        return uid;
                    }
                }
            }
        }
        return null;
    }

    private static Mask rasterize(String name, List<DicomDataset> contours, ImageGeometry geometry) {
        Mask mask = Mask.empty(geometry);
        Map<Integer, List<double[][]>> polygonsBySlice = new TreeMap<>();
        int columns = geometry.getColumns();
        int rows = geometry.getRows();

        for (DicomDataset contour : contours) {
            String type = contour.getString(DicomTag.ContourGeometricType, "CLOSED_PLANAR");
            double[] data = contour.getDoubles(DicomTag.ContourData);
            int points = data.length / 3;
            if (points == 0) {
                continue;
            }

            double[] xs = new double[points];
            double[] ys = new double[points];
            double sliceSum = 0;
            for (int p = 0; p < points; p++) {
                double[] index = geometry.physicalToIndex(new double[]{data[3 * p], data[3 * p + 1], data[3 * p + 2]});
                xs[p] = index[0];
                ys[p] = index[1];
                sliceSum += index[2];
            }
            int k = Resampler.nearest(sliceSum / points);
            if (k < 0 || k >= geometry.getSlices()) {
                log.warn("Contour of {} lies outside the series (slice {}), skipped", name, k);
                continue;
            }

            if ("POINT".equals(type)) {
                int i = Resampler.nearest(xs[0]);
                int j = Resampler.nearest(ys[0]);
                if (geometry.contains(i, j, k)) {
                    mask.set(i, j, k);
                }
            } else if ("CLOSED_PLANAR".equals(type) && points >= 3) {
                polygonsBySlice.computeIfAbsent(k, s -> new ArrayList<>()).add(new double[][]{xs, ys});
            } else {
                log.debug("Ignoring {} contour of {} with {} points", type, name, points);
            }
        }

        for (Map.Entry<Integer, List<double[][]>> slice : polygonsBySlice.entrySet()) {
            ContourRasterizer.fill(slice.getValue(), columns, rows, mask.getData(), slice.getKey() * columns * rows);
        }
        return mask;
    }
}
