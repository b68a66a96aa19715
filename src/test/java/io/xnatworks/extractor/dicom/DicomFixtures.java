/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.dicom;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds small synthetic CT series, DICOM SEG and RTSTRUCT files.
 *
 * <p>Image slices are axial with 1 mm pixels, 2 mm apart, slice k at z = 2k. Voxel values
 * follow {@link #voxelValue(int, int, int)} so that any reordering shows up in tests.</p>
 */
public final class DicomFixtures {

    public static final String CT_IMAGE_STORAGE = "1.2.840.10008.5.1.4.1.1.2";
    public static final String STUDY_UID = "1.2.826.0.1.3680043.8.498.1";
    public static final String FRAME_OF_REFERENCE_UID = "1.2.826.0.1.3680043.8.498.2";
    public static final double SLICE_SPACING = 2.0;

    private DicomFixtures() {
    }

    public static int voxelValue(int column, int row, int slice) {
        return slice * 100 + row * 10 + column;
    }

    public static DicomDataset imageSlice(String patientId, String seriesUid, String description,
                                          int slice, int rows, int columns) {
        DicomDataset ds = new DicomDataset();
        ds.putString(DicomTag.SOPClassUID, "UI", CT_IMAGE_STORAGE);
        ds.putString(DicomTag.SOPInstanceUID, "UI", seriesUid + "." + (slice + 1));
        ds.putString(DicomTag.Modality, "CS", "CT");
        if (description != null) {
            ds.putString(DicomTag.SeriesDescription, "LO", description);
        }
        ds.putString(DicomTag.PatientName, "PN", "Test^" + patientId);
        if (patientId != null) {
            ds.putString(DicomTag.PatientID, "LO", patientId);
        }
        ds.putString(DicomTag.PatientWeight, "DS", "72.5");
        ds.putString(DicomTag.SliceThickness, "DS", "2");
        ds.putString(DicomTag.StudyInstanceUID, "UI", STUDY_UID);
        ds.putString(DicomTag.SeriesInstanceUID, "UI", seriesUid);
        ds.putString(DicomTag.SeriesNumber, "IS", "1");
        ds.putString(DicomTag.InstanceNumber, "IS", String.valueOf(slice + 1));
        ds.putString(DicomTag.ImagePositionPatient, "DS", "0", "0", format(slice * SLICE_SPACING));
        ds.putString(DicomTag.ImageOrientationPatient, "DS", "1", "0", "0", "0", "1", "0");
        ds.putString(DicomTag.FrameOfReferenceUID, "UI", FRAME_OF_REFERENCE_UID);
        ds.putUnsignedShorts(DicomTag.SamplesPerPixel, 1);
        ds.putString(DicomTag.PhotometricInterpretation, "CS", "MONOCHROME2");
        ds.putUnsignedShorts(DicomTag.Rows, rows);
        ds.putUnsignedShorts(DicomTag.Columns, columns);
        ds.putString(DicomTag.PixelSpacing, "DS", "1", "1");
        ds.putUnsignedShorts(DicomTag.BitsAllocated, 16);
        ds.putUnsignedShorts(DicomTag.BitsStored, 16);
        ds.putUnsignedShorts(DicomTag.HighBit, 15);
        ds.putUnsignedShorts(DicomTag.PixelRepresentation, 0);

        int[] values = new int[rows * columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                values[r * columns + c] = voxelValue(c, r, slice);
            }
        }
        ds.putBytes(DicomTag.PixelData, "OW", shorts(values));
        return ds;
    }

    /**
     * Write one file per slice, in reverse slice order so readers have to sort.
     */
    public static List<Path> writeSeries(Path directory, String patientId, String seriesUid, String description,
                                         int rows, int columns, int slices) throws IOException {
        List<Path> files = new ArrayList<>();
        for (int k = slices - 1; k >= 0; k--) {
            DicomDataset slice = imageSlice(patientId, seriesUid, description, k, rows, columns);
            String name = seriesUid.substring(seriesUid.lastIndexOf('.') + 1) + "_" + k + ".dcm";
            files.add(DicomTestWriter.write(slice, directory.resolve(name)));
        }
        return files;
    }

    /**
     * A binary DICOM SEG on the grid of a series written by {@link #writeSeries}.
     *
     * @param segments label to mask; masks are column-fastest over columns x rows x slices
     */
    public static DicomDataset segmentation(String patientId, String referencedSeriesUid, int rows, int columns,
                                            int slices, Map<String, byte[]> segments) {
        DicomDataset ds = new DicomDataset();
        ds.putString(DicomTag.SOPClassUID, "UI", "1.2.840.10008.5.1.4.1.1.66.4");
        ds.putString(DicomTag.SOPInstanceUID, "UI", referencedSeriesUid + ".900");
        ds.putString(DicomTag.Modality, "CS", "SEG");
        ds.putString(DicomTag.PatientID, "LO", patientId);
        ds.putString(DicomTag.StudyInstanceUID, "UI", STUDY_UID);
        ds.putString(DicomTag.SeriesInstanceUID, "UI", referencedSeriesUid + ".9");
        ds.putString(DicomTag.FrameOfReferenceUID, "UI", FRAME_OF_REFERENCE_UID);

        DicomDataset reference = new DicomDataset();
        reference.putString(DicomTag.SeriesInstanceUID, "UI", referencedSeriesUid);
        ds.putSequence(DicomTag.ReferencedSeriesSequence, List.of(reference));

        List<DicomDataset> segmentItems = new ArrayList<>();
        List<DicomDataset> perFrame = new ArrayList<>();
        List<byte[]> frames = new ArrayList<>();
        int number = 1;
        for (Map.Entry<String, byte[]> segment : segments.entrySet()) {
            DicomDataset item = new DicomDataset();
            item.putUnsignedShorts(DicomTag.SegmentNumber, number);
            item.putString(DicomTag.SegmentLabel, "LO", segment.getKey());
            segmentItems.add(item);

            for (int k = 0; k < slices; k++) {
                byte[] frame = new byte[rows * columns];
                System.arraycopy(segment.getValue(), k * rows * columns, frame, 0, frame.length);
                frames.add(frame);

                DicomDataset identification = new DicomDataset();
                identification.putUnsignedShorts(DicomTag.ReferencedSegmentNumber, number);
                DicomDataset position = new DicomDataset();
                position.putString(DicomTag.ImagePositionPatient, "DS", "0", "0", format(k * SLICE_SPACING));
                DicomDataset group = new DicomDataset();
                group.putSequence(DicomTag.SegmentIdentificationSequence, List.of(identification));
                group.putSequence(DicomTag.PlanePositionSequence, List.of(position));
                perFrame.add(group);
            }
            number++;
        }
        ds.putSequence(DicomTag.SegmentSequence, segmentItems);

        DicomDataset orientation = new DicomDataset();
        orientation.putString(DicomTag.ImageOrientationPatient, "DS", "1", "0", "0", "0", "1", "0");
        DicomDataset measures = new DicomDataset();
        measures.putString(DicomTag.PixelSpacing, "DS", "1", "1");
        DicomDataset shared = new DicomDataset();
        shared.putSequence(DicomTag.PlaneOrientationSequence, List.of(orientation));
        shared.putSequence(DicomTag.PixelMeasuresSequence, List.of(measures));
        ds.putSequence(DicomTag.SharedFunctionalGroupsSequence, List.of(shared));
        ds.putSequence(DicomTag.PerFrameFunctionalGroupsSequence, perFrame);

        ds.putString(DicomTag.SegmentationType, "CS", "BINARY");
        ds.putUnsignedShorts(DicomTag.SamplesPerPixel, 1);
        ds.putString(DicomTag.PhotometricInterpretation, "CS", "MONOCHROME2");
        ds.putString(DicomTag.NumberOfFrames, "IS", String.valueOf(frames.size()));
        ds.putUnsignedShorts(DicomTag.Rows, rows);
        ds.putUnsignedShorts(DicomTag.Columns, columns);
        ds.putUnsignedShorts(DicomTag.BitsAllocated, 1);
        ds.putUnsignedShorts(DicomTag.BitsStored, 1);
        ds.putUnsignedShorts(DicomTag.HighBit, 0);
        ds.putUnsignedShorts(DicomTag.PixelRepresentation, 0);
        ds.putBytes(DicomTag.PixelData, "OB", packBits(frames, rows * columns));
        return ds;
    }

    /**
     * An RTSTRUCT with closed planar contours.
     *
     * @param contours ROI name to contours, each a flat x, y, z point list in patient coordinates
     */
    public static DicomDataset structureSet(String patientId, String referencedSeriesUid,
                                            Map<String, List<double[]>> contours) {
        DicomDataset ds = new DicomDataset();
        ds.putString(DicomTag.SOPClassUID, "UI", "1.2.840.10008.5.1.4.1.1.481.3");
        ds.putString(DicomTag.SOPInstanceUID, "UI", referencedSeriesUid + ".800");
        ds.putString(DicomTag.Modality, "CS", "RTSTRUCT");
        ds.putString(DicomTag.PatientID, "LO", patientId);
        ds.putString(DicomTag.StudyInstanceUID, "UI", STUDY_UID);
        ds.putString(DicomTag.SeriesInstanceUID, "UI", referencedSeriesUid + ".8");

        DicomDataset series = new DicomDataset();
        series.putString(DicomTag.SeriesInstanceUID, "UI", referencedSeriesUid);
        DicomDataset study = new DicomDataset();
        study.putSequence(DicomTag.RTReferencedSeriesSequence, List.of(series));
        DicomDataset frame = new DicomDataset();
        frame.putString(DicomTag.FrameOfReferenceUID, "UI", FRAME_OF_REFERENCE_UID);
        frame.putSequence(DicomTag.RTReferencedStudySequence, List.of(study));
        ds.putSequence(DicomTag.ReferencedFrameOfReferenceSequence, List.of(frame));

        List<DicomDataset> rois = new ArrayList<>();
        List<DicomDataset> roiContours = new ArrayList<>();
        int number = 1;
        for (Map.Entry<String, List<double[]>> roi : contours.entrySet()) {
            DicomDataset roiItem = new DicomDataset();
            roiItem.putString(DicomTag.ROINumber, "IS", String.valueOf(number));
            roiItem.putString(DicomTag.ROIName, "LO", roi.getKey());
            rois.add(roiItem);

            List<DicomDataset> contourItems = new ArrayList<>();
            for (double[] points : roi.getValue()) {
                DicomDataset contour = new DicomDataset();
                contour.putString(DicomTag.ContourGeometricType, "CS", "CLOSED_PLANAR");
                contour.putString(DicomTag.NumberOfContourPoints, "IS", String.valueOf(points.length / 3));
                String[] values = new String[points.length];
                for (int i = 0; i < points.length; i++) {
                    values[i] = format(points[i]);
                }
                contour.putString(DicomTag.ContourData, "DS", values);
                contourItems.add(contour);
            }
            DicomDataset roiContour = new DicomDataset();
            roiContour.putString(DicomTag.ReferencedROINumber, "IS", String.valueOf(number));
            roiContour.putSequence(DicomTag.ContourSequence, contourItems);
            roiContours.add(roiContour);
            number++;
        }
        ds.putSequence(DicomTag.StructureSetROISequence, rois);
        ds.putSequence(DicomTag.ROIContourSequence, roiContours);
        return ds;
    }

    /**
     * Axis-aligned square contour on slice k, corners at the given pixel-centre coordinates.
     */
    public static double[] square(double x0, double y0, double x1, double y1, int slice) {
        double z = slice * SLICE_SPACING;
        return new double[]{x0, y0, z, x1, y0, z, x1, y1, z, x0, y1, z};
    }

    public static byte[] shorts(int[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int value : values) {
            buffer.putShort((short) value);
        }
        return buffer.array();
    }

    private static byte[] packBits(List<byte[]> frames, int frameSize) {
        int total = frames.size() * frameSize;
        byte[] packed = new byte[(total + 7) / 8 + ((total + 7) / 8) % 2];
        int bit = 0;
        for (byte[] frame : frames) {
            for (byte value : frame) {
                if (value != 0) {
                    packed[bit >>> 3] |= (byte) (1 << (bit & 7));
                }
                bit++;
            }
        }
        return packed;
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
