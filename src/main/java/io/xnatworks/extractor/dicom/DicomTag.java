/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * DICOM tag constants used by the extractor, plus keyword lookup.
 *
 * <p>Keywords are the standard DICOM attribute keywords (e.g. {@code SeriesDescription}).
 * Lookup is case-insensitive and ignores underscores and dashes.</p>
 */
public final class DicomTag {

    // File meta information
    public static final int TransferSyntaxUID = 0x00020010;

    // Patient
    public static final int PatientName = 0x00100010;
    public static final int PatientID = 0x00100020;
    public static final int PatientBirthDate = 0x00100030;
    public static final int PatientSex = 0x00100040;
    public static final int PatientAge = 0x00101010;
    public static final int PatientWeight = 0x00101030;

    // Study / series / instance
    public static final int SpecificCharacterSet = 0x00080005;
    public static final int ImageType = 0x00080008;
    public static final int SOPClassUID = 0x00080016;
    public static final int SOPInstanceUID = 0x00080018;
    public static final int StudyDate = 0x00080020;
    public static final int SeriesDate = 0x00080021;
    public static final int AccessionNumber = 0x00080050;
    public static final int Modality = 0x00080060;
    public static final int Manufacturer = 0x00080070;
    public static final int InstitutionName = 0x00080080;
    public static final int StudyDescription = 0x00081030;
    public static final int SeriesDescription = 0x0008103E;
    public static final int ManufacturerModelName = 0x00081090;
    public static final int ReferencedSeriesSequence = 0x00081115;
    public static final int BodyPartExamined = 0x00180015;
    public static final int SliceThickness = 0x00180050;
    public static final int KVP = 0x00180060;
    public static final int ConvolutionKernel = 0x00181210;
    public static final int ProtocolName = 0x00181030;
    public static final int RepetitionTime = 0x00180080;
    public static final int EchoTime = 0x00180081;
    public static final int MagneticFieldStrength = 0x00180087;
    public static final int StudyInstanceUID = 0x0020000D;
    public static final int SeriesInstanceUID = 0x0020000E;
    public static final int StudyID = 0x00200010;
    public static final int SeriesNumber = 0x00200011;
    public static final int InstanceNumber = 0x00200013;
    public static final int ImagePositionPatient = 0x00200032;
    public static final int ImageOrientationPatient = 0x00200037;
    public static final int FrameOfReferenceUID = 0x00200052;
    public static final int SliceLocation = 0x00201041;
    public static final int PlanePositionSequence = 0x00209113;
    public static final int PlaneOrientationSequence = 0x00209116;

    // Image pixel
    public static final int SamplesPerPixel = 0x00280002;
    public static final int PhotometricInterpretation = 0x00280004;
    public static final int NumberOfFrames = 0x00280008;
    public static final int Rows = 0x00280010;
    public static final int Columns = 0x00280011;
    public static final int PixelSpacing = 0x00280030;
    public static final int BitsAllocated = 0x00280100;
    public static final int BitsStored = 0x00280101;
    public static final int HighBit = 0x00280102;
    public static final int PixelRepresentation = 0x00280103;
    public static final int WindowCenter = 0x00281050;
    public static final int WindowWidth = 0x00281051;
    public static final int RescaleIntercept = 0x00281052;
    public static final int RescaleSlope = 0x00281053;
    public static final int PixelMeasuresSequence = 0x00289110;

    // Segmentation
    public static final int SegmentationType = 0x00620001;
    public static final int SegmentSequence = 0x00620002;
    public static final int SegmentNumber = 0x00620004;
    public static final int SegmentLabel = 0x00620005;
    public static final int SegmentDescription = 0x00620006;
    public static final int SegmentIdentificationSequence = 0x0062000A;
    public static final int ReferencedSegmentNumber = 0x0062000B;
    public static final int SharedFunctionalGroupsSequence = 0x52009229;
    public static final int PerFrameFunctionalGroupsSequence = 0x52009230;

    // RT structure set
    public static final int ReferencedFrameOfReferenceSequence = 0x30060010;
    public static final int RTReferencedStudySequence = 0x30060012;
    public static final int RTReferencedSeriesSequence = 0x30060014;
    public static final int StructureSetROISequence = 0x30060020;
    public static final int ROINumber = 0x30060022;
    public static final int ROIName = 0x30060026;
    public static final int ROIContourSequence = 0x30060039;
    public static final int ContourSequence = 0x30060040;
    public static final int ContourGeometricType = 0x30060042;
    public static final int NumberOfContourPoints = 0x30060046;
    public static final int ContourData = 0x30060050;
    public static final int ReferencedROINumber = 0x30060084;

    public static final int PixelData = 0x7FE00010;

    // Delimiters
    public static final int Item = 0xFFFEE000;
    public static final int ItemDelimitationItem = 0xFFFEE00D;
    public static final int SequenceDelimitationItem = 0xFFFEE0DD;

    private static final Map<String, Integer> KEYWORDS;
    private static final Map<Integer, String> NAMES;

    static {
        Map<String, Integer> keywords = new HashMap<>();
        Map<Integer, String> names = new HashMap<>();
        for (Field field : DicomTag.class.getDeclaredFields()) {
            int mods = field.getModifiers();
            if (field.getType() == int.class && Modifier.isPublic(mods) && Modifier.isStatic(mods)) {
                try {
                    int tag = field.getInt(null);
                    keywords.put(normalize(field.getName()), tag);
                    names.put(tag, field.getName());
                } catch (IllegalAccessException e) {
                    throw new IllegalStateException("Cannot read tag constant " + field.getName(), e);
                }
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
        NAMES = Collections.unmodifiableMap(names);
    }

    private DicomTag() {
    }

    /**
     * Parse a tag spec: a keyword ({@code SeriesDescription}), a group/element pair
     * ({@code 0008,103E} or {@code (0008,103E)}) or eight hex digits ({@code 0008103E}).
     *
     * @return the tag, or -1 when the spec is not recognized
     */
    public static int parse(String tagSpec) {
        if (tagSpec == null || tagSpec.isBlank()) {
            return -1;
        }

        String cleaned = tagSpec.replace("(", "").replace(")", "").trim();
        if (cleaned.contains(",")) {
            try {
                String[] parts = cleaned.split(",");
                return Integer.parseInt(parts[0].trim(), 16) << 16 | Integer.parseInt(parts[1].trim(), 16);
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                return -1;
            }
        }

        Integer tag = KEYWORDS.get(normalize(cleaned));
        if (tag != null) {
            return tag;
        }

        if (cleaned.length() == 8) {
            try {
                return (int) Long.parseLong(cleaned, 16);
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * Keyword of a known tag, or its {@code (gggg,eeee)} form.
     */
    public static String nameOf(int tag) {
        String name = NAMES.get(tag);
        return name != null ? name : toHexString(tag);
    }

    public static String toHexString(int tag) {
        return String.format("(%04X,%04X)", tag >>> 16, tag & 0xFFFF);
    }

    private static String normalize(String keyword) {
        return keyword.toLowerCase().replace("_", "").replace("-", "");
    }
}
