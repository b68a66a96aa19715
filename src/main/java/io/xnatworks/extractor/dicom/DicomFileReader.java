/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Reads DICOM Part-10 files (and bare datasets without a preamble) into {@link DicomDataset}s.
 *
 * <p>Supported transfer syntaxes:
 * <ul>
 *   <li>Implicit VR Little Endian</li>
 *   <li>Explicit VR Little Endian</li>
 *   <li>Deflated Explicit VR Little Endian</li>
 *   <li>Compressed syntaxes, header only (pixel data is kept encapsulated and cannot be decoded)</li>
 * </ul>
 * Explicit VR Big Endian is retired and rejected.</p>
 */
public final class DicomFileReader {
    private static final Logger log = LoggerFactory.getLogger(DicomFileReader.class);

    public static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
    public static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";
    public static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";
    public static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";

    private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;
    private static final int PREAMBLE_LENGTH = 128;

    // VRs encoded with a reserved 2-byte field and a 4-byte length in explicit VR
    private static final Set<String> LONG_VRS = Set.of(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV");

    private static final Map<Integer, String> IMPLICIT_VRS = new HashMap<>();

    static {
        implicit("UI", DicomTag.TransferSyntaxUID, DicomTag.SOPClassUID, DicomTag.SOPInstanceUID,
                DicomTag.StudyInstanceUID, DicomTag.SeriesInstanceUID, DicomTag.FrameOfReferenceUID);
        implicit("CS", DicomTag.SpecificCharacterSet, DicomTag.ImageType, DicomTag.Modality,
                DicomTag.BodyPartExamined, DicomTag.PatientSex, DicomTag.PhotometricInterpretation,
                DicomTag.SegmentationType, DicomTag.ContourGeometricType);
        implicit("DA", DicomTag.PatientBirthDate, DicomTag.StudyDate, DicomTag.SeriesDate);
        implicit("SH", DicomTag.AccessionNumber, DicomTag.StudyID, DicomTag.ConvolutionKernel);
        implicit("LO", DicomTag.PatientID, DicomTag.Manufacturer, DicomTag.InstitutionName,
                DicomTag.StudyDescription, DicomTag.SeriesDescription, DicomTag.ManufacturerModelName,
                DicomTag.ProtocolName, DicomTag.SegmentLabel, DicomTag.ROIName);
        implicit("PN", DicomTag.PatientName);
        implicit("AS", DicomTag.PatientAge);
        implicit("ST", DicomTag.SegmentDescription);
        implicit("DS", DicomTag.PatientWeight, DicomTag.SliceThickness, DicomTag.KVP,
                DicomTag.RepetitionTime, DicomTag.EchoTime, DicomTag.MagneticFieldStrength,
                DicomTag.ImagePositionPatient, DicomTag.ImageOrientationPatient, DicomTag.SliceLocation,
                DicomTag.PixelSpacing, DicomTag.WindowCenter, DicomTag.WindowWidth,
                DicomTag.RescaleIntercept, DicomTag.RescaleSlope, DicomTag.ContourData);
        implicit("IS", DicomTag.SeriesNumber, DicomTag.InstanceNumber, DicomTag.NumberOfFrames,
                DicomTag.ROINumber, DicomTag.NumberOfContourPoints, DicomTag.ReferencedROINumber);
        implicit("US", DicomTag.SamplesPerPixel, DicomTag.Rows, DicomTag.Columns, DicomTag.BitsAllocated,
                DicomTag.BitsStored, DicomTag.HighBit, DicomTag.PixelRepresentation,
                DicomTag.SegmentNumber, DicomTag.ReferencedSegmentNumber);
        implicit("SQ", DicomTag.ReferencedSeriesSequence, DicomTag.PlanePositionSequence,
                DicomTag.PlaneOrientationSequence, DicomTag.PixelMeasuresSequence, DicomTag.SegmentSequence,
                DicomTag.SegmentIdentificationSequence, DicomTag.SharedFunctionalGroupsSequence,
                DicomTag.PerFrameFunctionalGroupsSequence, DicomTag.ReferencedFrameOfReferenceSequence,
                DicomTag.RTReferencedStudySequence, DicomTag.RTReferencedSeriesSequence,
                DicomTag.StructureSetROISequence, DicomTag.ROIContourSequence, DicomTag.ContourSequence);
        implicit("OW", DicomTag.PixelData);
    }

    private DicomFileReader() {
    }

    private static void implicit(String vr, int... tags) {
        for (int tag : tags) {
            IMPLICIT_VRS.put(tag, vr);
        }
    }

    /**
     * Quick check used while scanning directories: a {@code .dcm} extension or the
     * {@code DICM} magic at offset 128.
     */
    public static boolean isDicomFile(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        if (name.endsWith(".dcm") || name.endsWith(".dicom")) {
            return true;
        }

        try {
            if (Files.size(file) > PREAMBLE_LENGTH + 4) {
                try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
                    raf.seek(PREAMBLE_LENGTH);
                    byte[] magic = new byte[4];
                    raf.readFully(magic);
                    return magic[0] == 'D' && magic[1] == 'I' && magic[2] == 'C' && magic[3] == 'M';
                }
            }
        } catch (IOException e) {
            log.debug("Cannot probe {}: {}", file, e.getMessage());
        }
        return false;
    }

    /**
     * Read a complete file, pixel data included.
     */
    public static DicomDataset read(Path file) throws IOException {
        return read(file, false);
    }

    /**
     * Read everything up to, but not including, the top-level Pixel Data element.
     */
    public static DicomDataset readHeader(Path file) throws IOException {
        return read(file, true);
    }

    private static DicomDataset read(Path file, boolean stopAtPixelData) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file), 64 * 1024)) {
            return parse(in, stopAtPixelData);
        } catch (EOFException e) {
            throw new DicomFormatException("Unexpected end of file: " + file, e);
        } catch (DicomFormatException e) {
            throw new DicomFormatException(e.getMessage() + ": " + file, e);
        }
    }

    /**
     * Parse a dataset from a stream that supports mark/reset.
     */
    static DicomDataset parse(InputStream stream, boolean stopAtPixelData) throws IOException {
        if (!stream.markSupported()) {
            stream = new BufferedInputStream(stream);
        }

        stream.mark(PREAMBLE_LENGTH + 4);
        byte[] preamble = stream.readNBytes(PREAMBLE_LENGTH + 4);
        boolean hasPreamble = preamble.length == PREAMBLE_LENGTH + 4
                && preamble[128] == 'D' && preamble[129] == 'I' && preamble[130] == 'C' && preamble[131] == 'M';
        if (!hasPreamble) {
            stream.reset();
        }

        DicomDataset dataset = new DicomDataset();
        DicomInput in = new DicomInput(stream);

        int firstGroup = in.peekGroup();
        if (firstGroup < 0) {
            throw new DicomFormatException("Empty file");
        }

        String transferSyntax;
        if (firstGroup == 0x0002) {
            new Parser(true, false).readFileMeta(in, dataset);
            transferSyntax = dataset.getString(DicomTag.TransferSyntaxUID);
            if (transferSyntax == null) {
                throw new DicomFormatException("File meta information has no transfer syntax");
            }
        } else if (hasPreamble || firstGroup == 0x0008) {
            transferSyntax = in.looksExplicit() ? EXPLICIT_VR_LITTLE_ENDIAN : IMPLICIT_VR_LITTLE_ENDIAN;
        } else {
            throw new DicomFormatException("Not a DICOM file");
        }

        if (EXPLICIT_VR_BIG_ENDIAN.equals(transferSyntax)) {
            throw new DicomFormatException("Explicit VR Big Endian is not supported");
        }
        if (DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN.equals(transferSyntax)) {
            in = new DicomInput(new BufferedInputStream(new InflaterInputStream(stream, new Inflater(true))));
        }

        boolean explicit = !IMPLICIT_VR_LITTLE_ENDIAN.equals(transferSyntax);
        new Parser(explicit, stopAtPixelData).readElements(in, -1, true, dataset, 0);
        return dataset;
    }

    static String implicitVr(int tag) {
        if ((tag & 0xFFFF) == 0) {
            return "UL";
        }
        String vr = IMPLICIT_VRS.get(tag);
        return vr != null ? vr : "UN";
    }

    // ========================================================================
    // Element parser
    // ========================================================================

    private static final class Parser {
        private final boolean explicit;
        private final boolean stopAtPixelData;
        private boolean stopped;

        Parser(boolean explicit, boolean stopAtPixelData) {
            this.explicit = explicit;
            this.stopAtPixelData = stopAtPixelData;
        }

        void readFileMeta(DicomInput in, DicomDataset dataset) throws IOException {
            while (in.peekGroup() == 0x0002) {
                readElement(in, true, dataset, 0);
            }
        }

        /**
         * Read elements until {@code end} (absolute position), the end of the stream when
         * {@code untilEof}, or an item delimiter when {@code end} is negative.
         */
        void readElements(DicomInput in, long end, boolean untilEof, DicomDataset dataset, int depth)
                throws IOException {
            while (!stopped) {
                if (untilEof) {
                    if (in.atEnd()) {
                        return;
                    }
                } else if (end >= 0 && in.position() >= end) {
                    return;
                }
                if (!readElement(in, explicit, dataset, depth)) {
                    return;
                }
            }
        }

        /**
         * @return false when an item delimiter was consumed
         */
        private boolean readElement(DicomInput in, boolean explicitVr, DicomDataset dataset, int depth)
                throws IOException {
            int tag = in.readTag();
            if (tag == DicomTag.ItemDelimitationItem) {
                in.readUnsignedInt();
                return false;
            }

            String vr;
            long length;
            if (explicitVr && (tag >>> 16) != 0xFFFE) {
                vr = in.readVr();
                if (LONG_VRS.contains(vr)) {
                    in.skip(2);
                    length = in.readUnsignedInt();
                } else {
                    length = in.readUnsignedShort();
                }
            } else {
                vr = implicitVr(tag);
                length = in.readUnsignedInt();
            }

            if (tag == DicomTag.PixelData && depth == 0 && stopAtPixelData) {
                stopped = true;
                return false;
            }

            if ("SQ".equals(vr) || (length == UNDEFINED_LENGTH && tag != DicomTag.PixelData)) {
                // UN with undefined length holds an implicit VR sequence
                boolean itemsExplicit = explicitVr && !"UN".equals(vr);
                dataset.put(new DicomElement(tag, readItems(in, itemsExplicit, length, dataset.getCharset(), depth)));
            } else if (length == UNDEFINED_LENGTH) {
                dataset.put(new DicomElement(tag, vr, readFragments(in), true));
            } else {
                dataset.put(new DicomElement(tag, vr, in.readBytes(length), false));
            }
            return true;
        }

        private List<DicomDataset> readItems(DicomInput in, boolean itemsExplicit, long length,
                                             Charset charset, int depth) throws IOException {
            List<DicomDataset> items = new ArrayList<>();
            long end = length == UNDEFINED_LENGTH ? -1 : in.position() + length;
            Parser itemParser = itemsExplicit == explicit ? this : new Parser(itemsExplicit, false);

            while (end < 0 || in.position() < end) {
                int tag = in.readTag();
                long itemLength = in.readUnsignedInt();
                if (tag == DicomTag.SequenceDelimitationItem) {
                    break;
                }
                if (tag != DicomTag.Item) {
                    throw new DicomFormatException("Expected item in sequence, found " + DicomTag.toHexString(tag));
                }
                DicomDataset item = new DicomDataset();
                item.setCharset(charset);
                long itemEnd = itemLength == UNDEFINED_LENGTH ? -1 : in.position() + itemLength;
                itemParser.readElements(in, itemEnd, false, item, depth + 1);
                items.add(item);
            }
            return items;
        }

        private byte[] readFragments(DicomInput in) throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            boolean offsetTable = true;
            while (true) {
                int tag = in.readTag();
                long length = in.readUnsignedInt();
                if (tag == DicomTag.SequenceDelimitationItem) {
                    break;
                }
                if (tag != DicomTag.Item) {
                    throw new DicomFormatException("Expected pixel data fragment, found " + DicomTag.toHexString(tag));
                }
                byte[] fragment = in.readBytes(length);
                if (!offsetTable) {
                    out.write(fragment);
                }
                offsetTable = false;
            }
            return out.toByteArray();
        }
    }

    // ========================================================================
    // Little-endian input with position tracking
    // ========================================================================

    private static final class DicomInput {
        private final InputStream in;
        private long position;

        DicomInput(InputStream in) {
            this.in = in;
        }

        long position() {
            return position;
        }

        boolean atEnd() throws IOException {
            in.mark(1);
            int b = in.read();
            in.reset();
            return b < 0;
        }

        int peekGroup() throws IOException {
            in.mark(2);
            int b0 = in.read();
            int b1 = in.read();
            in.reset();
            if (b0 < 0 || b1 < 0) {
                return -1;
            }
            return b0 | (b1 << 8);
        }

        /**
         * True when bytes 4-5 of the next element look like an explicit VR.
         */
        boolean looksExplicit() throws IOException {
            in.mark(6);
            byte[] head = in.readNBytes(6);
            in.reset();
            return head.length == 6 && Character.isUpperCase(head[4]) && Character.isUpperCase(head[5]);
        }

        int readUnsignedShort() throws IOException {
            int b0 = in.read();
            int b1 = in.read();
            if ((b0 | b1) < 0) {
                throw new EOFException();
            }
            position += 2;
            return b0 | (b1 << 8);
        }

        long readUnsignedInt() throws IOException {
            long low = readUnsignedShort();
            long high = readUnsignedShort();
            return low | (high << 16);
        }

        int readTag() throws IOException {
            int group = readUnsignedShort();
            int element = readUnsignedShort();
            return (group << 16) | element;
        }

        String readVr() throws IOException {
            byte[] vr = readBytes(2);
            if (!Character.isUpperCase(vr[0]) || !Character.isUpperCase(vr[1])) {
                throw new DicomFormatException(String.format("Invalid VR bytes 0x%02X%02X", vr[0], vr[1]));
            }
            return new String(vr, StandardCharsets.US_ASCII);
        }

        byte[] readBytes(long length) throws IOException {
            if (length > Integer.MAX_VALUE - 8) {
                throw new DicomFormatException("Element length too large: " + length);
            }
            byte[] bytes = in.readNBytes((int) length);
            if (bytes.length != length) {
                throw new EOFException();
            }
            position += length;
            return bytes;
        }

        void skip(long count) throws IOException {
            readBytes(count);
        }
    }
}
