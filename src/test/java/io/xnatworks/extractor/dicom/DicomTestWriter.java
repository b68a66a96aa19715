/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.dicom;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Writes datasets as DICOM files for tests. Sequences and items use undefined lengths.
 */
public final class DicomTestWriter {

    private static final Set<String> LONG_VRS = Set.of(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV");

    private DicomTestWriter() {
    }

    /**
     * Part-10 file, explicit VR little endian.
     */
    public static Path write(DicomDataset dataset, Path file) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(new byte[128]);
        out.write(new byte[]{'D', 'I', 'C', 'M'});

        DicomDataset meta = new DicomDataset();
        meta.putString(DicomTag.TransferSyntaxUID, "UI", DicomFileReader.EXPLICIT_VR_LITTLE_ENDIAN);
        writeElements(out, meta, true);
        writeElements(out, dataset, true);

        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.write(file, out.toByteArray());
        return file;
    }

    /**
     * Bare implicit VR little endian dataset, no preamble and no file meta information.
     */
    public static Path writeImplicit(DicomDataset dataset, Path file) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeElements(out, dataset, false);
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.write(file, out.toByteArray());
        return file;
    }

    private static void writeElements(ByteArrayOutputStream out, DicomDataset dataset, boolean explicit) {
        for (DicomElement element : dataset.elements()) {
            writeTag(out, element.getTag());
            if (element.isSequence()) {
                if (explicit) {
                    out.write('S');
                    out.write('Q');
                    writeShort(out, 0);
                }
                writeInt(out, 0xFFFFFFFF);
                for (DicomDataset item : element.getItems()) {
                    writeTag(out, DicomTag.Item);
                    writeInt(out, 0xFFFFFFFF);
                    writeElements(out, item, explicit);
                    writeTag(out, DicomTag.ItemDelimitationItem);
                    writeInt(out, 0);
                }
                writeTag(out, DicomTag.SequenceDelimitationItem);
                writeInt(out, 0);
                continue;
            }

            byte[] value = element.getValue();
            if (value.length % 2 != 0) {
                byte[] padded = new byte[value.length + 1];
                System.arraycopy(value, 0, padded, 0, value.length);
                value = padded;
            }
            if (explicit) {
                String vr = element.getVr();
                out.write(vr.charAt(0));
                out.write(vr.charAt(1));
                if (LONG_VRS.contains(vr)) {
                    writeShort(out, 0);
                    writeInt(out, value.length);
                } else {
                    writeShort(out, value.length);
                }
            } else {
                writeInt(out, value.length);
            }
            out.write(value, 0, value.length);
        }
    }

    private static void writeTag(ByteArrayOutputStream out, int tag) {
        writeShort(out, tag >>> 16);
        writeShort(out, tag & 0xFFFF);
    }

    private static void writeShort(ByteArrayOutputStream out, int value) {
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        writeShort(out, value & 0xFFFF);
        writeShort(out, value >>> 16);
    }
}
