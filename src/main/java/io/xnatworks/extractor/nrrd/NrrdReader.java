/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.nrrd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Reads attached-header NRRD files with integer or floating point samples.
 *
 * <p>Encodings: {@code raw}, {@code gzip} and {@code ascii}. Floating point samples are
 * rounded to the nearest integer since only label volumes are read.</p>
 */
public final class NrrdReader {
    private static final Logger log = LoggerFactory.getLogger(NrrdReader.class);

    private static final Pattern VECTOR = Pattern.compile("\\(([^)]*)\\)|none");

    private NrrdReader() {
    }

    public static boolean isNrrdFile(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".nrrd");
    }

    public static NrrdFile read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return parse(bytes);
        } catch (NrrdFormatException e) {
            throw new NrrdFormatException(e.getMessage() + ": " + file, e);
        }
    }

    static NrrdFile parse(byte[] bytes) throws IOException {
        if (bytes.length < 8 || !new String(bytes, 0, 4, StandardCharsets.US_ASCII).equals("NRRD")) {
            throw new NrrdFormatException("Missing NRRD magic");
        }

        int headerEnd = findHeaderEnd(bytes);
        if (headerEnd < 0) {
            throw new NrrdFormatException("Header is not terminated by a blank line");
        }

        String header = new String(bytes, 0, headerEnd, StandardCharsets.ISO_8859_1);
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, String> keyValues = new LinkedHashMap<>();
        String[] lines = header.split("\\r?\\n");
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            int kv = line.indexOf(":=");
            int field = line.indexOf(": ");
            if (kv >= 0 && (field < 0 || kv < field)) {
                keyValues.put(line.substring(0, kv), line.substring(kv + 2));
            } else if (field >= 0) {
                fields.put(line.substring(0, field).trim().toLowerCase(), line.substring(field + 2).trim());
            } else {
                log.debug("Ignoring NRRD header line: {}", line);
            }
        }

        if (fields.containsKey("data file") || fields.containsKey("datafile")) {
            throw new NrrdFormatException("Detached NRRD data files are not supported");
        }

        int[] sizes = parseSizes(required(fields, "sizes"));
        int dimension = Integer.parseInt(required(fields, "dimension"));
        if (sizes.length != dimension) {
            throw new NrrdFormatException("Dimension " + dimension + " does not match sizes " + fields.get("sizes"));
        }

        SampleType type = SampleType.of(required(fields, "type"));
        ByteOrder order = "big".equalsIgnoreCase(fields.get("endian")) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;

        long count = 1;
        for (int s : sizes) {
            count *= s;
        }
        if (count > Integer.MAX_VALUE) {
            throw new NrrdFormatException("Volume too large: " + count + " samples");
        }

        String encoding = required(fields, "encoding").toLowerCase();
        int[] data;
        switch (encoding) {
            case "raw":
                data = decodeBinary(slice(bytes, headerEnd), type, order, (int) count);
                break;
            case "gzip":
            case "gz":
                try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(slice(bytes, headerEnd)))) {
                    data = decodeBinary(in.readAllBytes(), type, order, (int) count);
                }
                break;
            case "ascii":
            case "text":
            case "txt":
                data = decodeText(slice(bytes, headerEnd), (int) count);
                break;
            default:
                throw new NrrdFormatException("Unsupported encoding: " + encoding);
        }

        return new NrrdFile(fields, keyValues, sizes,
                parseDirections(fields.get("space directions"), dimension),
                parseOrigin(fields.get("space origin")), data);
    }

    private static int findHeaderEnd(byte[] bytes) {
        for (int i = 0; i < bytes.length - 1; i++) {
            if (bytes[i] == '\n' && bytes[i + 1] == '\n') {
                return i + 2;
            }
            if (bytes[i] == '\n' && bytes[i + 1] == '\r' && i + 2 < bytes.length && bytes[i + 2] == '\n') {
                return i + 3;
            }
        }
        return -1;
    }

    private static byte[] slice(byte[] bytes, int from) {
        byte[] payload = new byte[bytes.length - from];
        System.arraycopy(bytes, from, payload, 0, payload.length);
        return payload;
    }

    private static String required(Map<String, String> fields, String name) throws NrrdFormatException {
        String value = fields.get(name);
        if (value == null) {
            throw new NrrdFormatException("Missing required field '" + name + "'");
        }
        return value;
    }

    private static int[] parseSizes(String value) throws NrrdFormatException {
        String[] parts = value.trim().split("\\s+");
        int[] sizes = new int[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                sizes[i] = Integer.parseInt(parts[i]);
            }
        } catch (NumberFormatException e) {
            throw new NrrdFormatException("Invalid sizes: " + value, e);
        }
        return sizes;
    }

    private static double[][] parseDirections(String value, int dimension) throws NrrdFormatException {
        if (value == null) {
            return null;
        }
        List<double[]> vectors = new ArrayList<>();
        Matcher matcher = VECTOR.matcher(value);
        while (matcher.find()) {
            vectors.add(matcher.group(1) != null ? parseVector(matcher.group(1)) : null);
        }
        if (vectors.size() != dimension) {
            throw new NrrdFormatException("Expected " + dimension + " space directions, found " + vectors.size());
        }
        return vectors.toArray(new double[0][]);
    }

    private static double[] parseOrigin(String value) throws NrrdFormatException {
        if (value == null) {
            return null;
        }
        Matcher matcher = VECTOR.matcher(value);
        if (!matcher.find() || matcher.group(1) == null) {
            throw new NrrdFormatException("Invalid space origin: " + value);
        }
        return parseVector(matcher.group(1));
    }

    private static double[] parseVector(String text) throws NrrdFormatException {
        String[] parts = text.split(",");
        double[] vector = new double[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                vector[i] = Double.parseDouble(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            throw new NrrdFormatException("Invalid vector: (" + text + ")", e);
        }
        return vector;
    }

    private static int[] decodeBinary(byte[] payload, SampleType type, ByteOrder order, int count)
            throws NrrdFormatException {
        long required = (long) count * type.width;
        if (payload.length < required) {
            throw new NrrdFormatException("Data truncated: expected " + required + " bytes, found " + payload.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload).order(order);
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            switch (type) {
                case INT8:
                    values[i] = buffer.get();
                    break;
                case UINT8:
                    values[i] = buffer.get() & 0xFF;
                    break;
                case INT16:
                    values[i] = buffer.getShort();
                    break;
                case UINT16:
                    values[i] = buffer.getShort() & 0xFFFF;
                    break;
                case INT32:
                case UINT32:
                    values[i] = buffer.getInt();
                    break;
                case INT64:
                case UINT64:
                    values[i] = (int) buffer.getLong();
                    break;
                case FLOAT:
                    values[i] = Math.round(buffer.getFloat());
                    break;
                default:
                    values[i] = (int) Math.round(buffer.getDouble());
                    break;
            }
        }
        return values;
    }

    private static int[] decodeText(byte[] payload, int count) throws NrrdFormatException {
        String[] tokens = new String(payload, StandardCharsets.US_ASCII).trim().split("\\s+");
        if (tokens.length < count) {
            throw new NrrdFormatException("Data truncated: expected " + count + " values, found " + tokens.length);
        }
        int[] values = new int[count];
        try {
            for (int i = 0; i < count; i++) {
                values[i] = (int) Math.round(Double.parseDouble(tokens[i]));
            }
        } catch (NumberFormatException e) {
            throw new NrrdFormatException("Invalid sample value", e);
        }
        return values;
    }

    private enum SampleType {
        INT8(1), UINT8(1), INT16(2), UINT16(2), INT32(4), UINT32(4), INT64(8), UINT64(8), FLOAT(4), DOUBLE(8);

        private final int width;

        SampleType(int width) {
            this.width = width;
        }

        static SampleType of(String name) throws NrrdFormatException {
            switch (name.trim().toLowerCase()) {
                case "signed char": case "int8": case "int8_t":
                    return INT8;
                case "uchar": case "unsigned char": case "uint8": case "uint8_t":
                    return UINT8;
                case "short": case "short int": case "signed short": case "signed short int":
                case "int16": case "int16_t":
                    return INT16;
                case "ushort": case "unsigned short": case "unsigned short int": case "uint16": case "uint16_t":
                    return UINT16;
                case "int": case "signed int": case "int32": case "int32_t":
                    return INT32;
                case "uint": case "unsigned int": case "uint32": case "uint32_t":
                    return UINT32;
                case "longlong": case "long long": case "long long int": case "signed long long":
                case "signed long long int": case "int64": case "int64_t":
                    return INT64;
                case "ulonglong": case "unsigned long long": case "unsigned long long int":
                case "uint64": case "uint64_t":
                    return UINT64;
                case "float":
                    return FLOAT;
                case "double":
                    return DOUBLE;
                default:
                    throw new NrrdFormatException("Unsupported sample type: " + name);
            }
        }
    }
}
