/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.series;

import io.xnatworks.extractor.dicom.DicomDataset;
import io.xnatworks.extractor.dicom.DicomFileReader;
import io.xnatworks.extractor.dicom.DicomTag;
import io.xnatworks.extractor.dicom.PixelDataDecoder;
import io.xnatworks.extractor.dicom.SopClass;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.ImageSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the DICOM files of one patient into image series and orders their slices in space.
 *
 * <p>Slices are sorted by the projection of Image Position (Patient) on the slice normal.
 * When positions or orientation are missing, Slice Location is used, then Instance Number.
 * A series whose slices disagree on size, pixel spacing or orientation, or that has two
 * slices at the same position, is dropped.</p>
 */
public class SeriesGrouper {
    private static final Logger log = LoggerFactory.getLogger(SeriesGrouper.class);

    private static final double GEOMETRY_TOLERANCE = 1e-3;
    private static final double SPACING_VARIATION = 0.01;

    private static final int[] METADATA_TAGS = {
            DicomTag.Modality, DicomTag.SeriesDescription, DicomTag.SeriesNumber,
            DicomTag.StudyInstanceUID, DicomTag.FrameOfReferenceUID, DicomTag.PatientID
    };

    private final int matchTag;

    /**
     * @param matchTag tag whose value becomes the series description
     */
    public SeriesGrouper(int matchTag) {
        this.matchTag = matchTag;
    }

    public SeriesGrouper() {
        this(DicomTag.SeriesDescription);
    }

    public GroupingResult group(List<Path> files) {
        GroupingResult result = new GroupingResult();
        Map<String, List<Slice>> groups = new LinkedHashMap<>();

        for (Path file : files) {
            DicomDataset header;
            try {
                header = DicomFileReader.readHeader(file);
            } catch (IOException e) {
                log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
                result.getFailures().add(new FailureRecord(null, FailureReason.UNREADABLE_FILE,
                        file + ": " + e.getMessage()));
                continue;
            }
            result.incrementReadableFiles();

            String patientId = header.getString(DicomTag.PatientID);
            if (patientId != null) {
                result.getPatientIds().add(patientId);
            }

            if (SopClass.isSegmentation(header) || SopClass.isStructureSet(header)) {
                result.getSegmentationObjects().put(file, header);
                continue;
            }
            if (!header.contains(DicomTag.Rows)) {
                log.debug("Skipping {}: not an image", file);
                continue;
            }
            String seriesUid = header.getString(DicomTag.SeriesInstanceUID);
            if (seriesUid == null) {
                log.warn("Skipping {}: no Series Instance UID", file);
                result.getFailures().add(new FailureRecord(null, FailureReason.UNREADABLE_FILE,
                        file + ": no Series Instance UID"));
                continue;
            }
            groups.computeIfAbsent(seriesUid, uid -> new ArrayList<>()).add(new Slice(file, header));
        }

        for (Map.Entry<String, List<Slice>> group : groups.entrySet()) {
            try {
                ImageSeries series = buildSeries(group.getKey(), group.getValue());
                result.getSeries().add(series);
                log.debug("Series {} '{}': {} slices", series.getSeriesInstanceUid(),
                        series.getDescription(), series.getFiles().size());
            } catch (GeometryException e) {
                log.warn("Dropping series {}: {}", group.getKey(), e.getMessage());
                result.getFailures().add(new FailureRecord(null, e.reason,
                        "Series " + group.getKey() + ": " + e.getMessage()));
            }
        }
        return result;
    }

    private ImageSeries buildSeries(String seriesUid, List<Slice> slices) throws GeometryException {
        DicomDataset first = slices.get(0).header;
        int rows = first.getInt(DicomTag.Rows, 0);
        int columns = first.getInt(DicomTag.Columns, 0);
        double[] pixelSpacing = first.getDoubles(DicomTag.PixelSpacing);
        double[] orientation = first.getDoubles(DicomTag.ImageOrientationPatient);

        if (rows <= 0 || columns <= 0) {
            throw new GeometryException(FailureReason.INCONSISTENT_GEOMETRY, "missing image size");
        }
        for (Slice slice : slices) {
            if (PixelDataDecoder.frameCount(slice.header) > 1) {
                throw new GeometryException(FailureReason.UNREADABLE_SERIES, "multi-frame images are not supported");
            }
            if (slice.header.getInt(DicomTag.Rows, 0) != rows || slice.header.getInt(DicomTag.Columns, 0) != columns) {
                throw new GeometryException(FailureReason.INCONSISTENT_GEOMETRY, "slices differ in size");
            }
            if (!close(slice.header.getDoubles(DicomTag.PixelSpacing), pixelSpacing)) {
                throw new GeometryException(FailureReason.INCONSISTENT_GEOMETRY, "slices differ in pixel spacing");
            }
            if (!close(slice.header.getDoubles(DicomTag.ImageOrientationPatient), orientation)) {
                throw new GeometryException(FailureReason.INCONSISTENT_GEOMETRY, "slices differ in orientation");
            }
        }

        double[] rowDirection = {1, 0, 0};
        double[] columnDirection = {0, 1, 0};
        if (orientation.length == 6) {
            rowDirection = new double[]{orientation[0], orientation[1], orientation[2]};
            columnDirection = new double[]{orientation[3], orientation[4], orientation[5]};
        }
        double[] normal = cross(rowDirection, columnDirection);

        boolean byPosition = orientation.length == 6 && allHave(slices, DicomTag.ImagePositionPatient, 3);
        if (byPosition) {
            for (Slice slice : slices) {
                slice.position = dot(slice.header.getDoubles(DicomTag.ImagePositionPatient), normal);
            }
        } else if (allHave(slices, DicomTag.SliceLocation, 1)) {
            for (Slice slice : slices) {
                slice.position = slice.header.getDouble(DicomTag.SliceLocation, 0);
            }
        } else {
            for (Slice slice : slices) {
                slice.position = slice.header.getInt(DicomTag.InstanceNumber, 0);
            }
        }
        slices.sort(Comparator.comparingDouble(s -> s.position));

        double sliceSpacing = first.getDouble(DicomTag.SliceThickness, 1.0);
        if (byPosition && slices.size() > 1) {
            for (int i = 1; i < slices.size(); i++) {
                if (slices.get(i).position - slices.get(i - 1).position < GEOMETRY_TOLERANCE) {
                    throw new GeometryException(FailureReason.INCONSISTENT_GEOMETRY,
                            "two slices at position " + slices.get(i).position);
                }
            }
            double extent = slices.get(slices.size() - 1).position - slices.get(0).position;
            sliceSpacing = extent / (slices.size() - 1);
            for (int i = 1; i < slices.size(); i++) {
                double gap = slices.get(i).position - slices.get(i - 1).position;
                if (Math.abs(gap - sliceSpacing) > SPACING_VARIATION * sliceSpacing) {
                    log.warn("Series {} has uneven slice spacing ({} vs {} mm)", seriesUid, gap, sliceSpacing);
                    break;
                }
            }
        }
        if (!(sliceSpacing > 0)) {
            sliceSpacing = 1.0;
        }

        DicomDataset reference = slices.get(0).header;
        double[] origin = reference.getDoubles(DicomTag.ImagePositionPatient);
        if (origin.length != 3) {
            origin = new double[3];
        }
        double[] spacing = pixelSpacing.length == 2
                ? new double[]{pixelSpacing[1], pixelSpacing[0], sliceSpacing}
                : new double[]{1, 1, sliceSpacing};
        double[] direction = {
                rowDirection[0], columnDirection[0], normal[0],
                rowDirection[1], columnDirection[1], normal[1],
                rowDirection[2], columnDirection[2], normal[2]
        };

        ImageGeometry geometry;
        try {
            geometry = new ImageGeometry(new int[]{columns, rows, slices.size()}, spacing, origin, direction);
        } catch (IllegalArgumentException e) {
            throw new GeometryException(FailureReason.INCONSISTENT_GEOMETRY, e.getMessage());
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        for (int tag : METADATA_TAGS) {
            String value = reference.getValueAsString(tag);
            if (value != null && !value.isEmpty()) {
                metadata.put(DicomTag.nameOf(tag), value);
            }
        }

        List<Path> ordered = new ArrayList<>();
        for (Slice slice : slices) {
            ordered.add(slice.file);
        }
        return new ImageSeries(seriesUid, reference.getString(matchTag), ordered, metadata, reference, geometry);
    }

    private static boolean allHave(List<Slice> slices, int tag, int count) {
        for (Slice slice : slices) {
            if (slice.header.getDoubles(tag).length < count) {
                return false;
            }
        }
        return true;
    }

    private static boolean close(double[] a, double[] b) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > GEOMETRY_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    static double[] cross(double[] a, double[] b) {
        return new double[]{
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]
        };
    }

    static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    private static final class Slice {
        final Path file;
        final DicomDataset header;
        double position;

        Slice(Path file, DicomDataset header) {
            this.file = file;
            this.header = header;
        }
    }

    private static final class GeometryException extends Exception {
        final FailureReason reason;

        GeometryException(FailureReason reason, String message) {
            super(message);
            this.reason = reason;
        }
    }
}
