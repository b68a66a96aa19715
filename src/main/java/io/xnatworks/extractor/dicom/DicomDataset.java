/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * An ordered set of DICOM data elements, either a top-level dataset or a sequence item.
 *
 * <p>Values are kept as raw little-endian bytes and decoded on access according to their
 * value representation, so numeric getters work for both string encoded (IS, DS) and
 * binary (US, SS, UL, SL, FL, FD) values.</p>
 */
public class DicomDataset {

    private static final Set<String> TEXT_VRS = Set.of(
            "AE", "AS", "CS", "DA", "DS", "DT", "IS", "LO", "LT", "PN", "SH", "ST", "TM", "UC", "UI", "UR", "UT");

    private final Map<Integer, DicomElement> elements = new TreeMap<>(Integer::compareUnsigned);
    private Charset charset = StandardCharsets.ISO_8859_1;

    public boolean contains(int tag) {
        return elements.containsKey(tag);
    }

    public DicomElement getElement(int tag) {
        return elements.get(tag);
    }

    public Collection<DicomElement> elements() {
        return Collections.unmodifiableCollection(elements.values());
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public String getVr(int tag) {
        DicomElement element = elements.get(tag);
        return element != null ? element.getVr() : null;
    }

    // ------------------------------------------------------------------
    // Strings
    // ------------------------------------------------------------------

    /**
     * First value of a text element, trimmed; null when absent or empty.
     */
    public String getString(int tag) {
        String[] values = getStrings(tag);
        return values.length > 0 && !values[0].isEmpty() ? values[0] : null;
    }

    public String getString(int tag, String defaultValue) {
        String value = getString(tag);
        return value != null ? value : defaultValue;
    }

    /**
     * All backslash-separated values of an element. Binary numeric values are rendered
     * in decimal so every element has a string form.
     */
    public String[] getStrings(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || element.isSequence()) {
            return new String[0];
        }
        if (isBinaryNumeric(element.getVr())) {
            double[] numbers = decodeBinary(element);
            String[] values = new String[numbers.length];
            for (int i = 0; i < numbers.length; i++) {
                values[i] = formatNumber(numbers[i]);
            }
            return values;
        }
        String text = decodeText(element.getValue());
        if (text.isEmpty()) {
            return new String[0];
        }
        String[] parts = text.split("\\\\", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return parts;
    }

    /**
     * Whole value of an element as it would appear in a header dump: multiple values
     * joined with a backslash. Null when absent.
     */
    public String getValueAsString(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || element.isSequence()) {
            return null;
        }
        return String.join("\\", getStrings(tag));
    }

    // ------------------------------------------------------------------
    // Numbers
    // ------------------------------------------------------------------

    public int getInt(int tag, int defaultValue) {
        double[] values = getDoubles(tag);
        return values.length > 0 && !Double.isNaN(values[0]) ? (int) values[0] : defaultValue;
    }

    public double getDouble(int tag, double defaultValue) {
        double[] values = getDoubles(tag);
        return values.length > 0 && !Double.isNaN(values[0]) ? values[0] : defaultValue;
    }

    /**
     * Numeric values of an element. Unparseable string values decode to NaN.
     */
    public double[] getDoubles(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || element.isSequence()) {
            return new double[0];
        }
        if (isBinaryNumeric(element.getVr())) {
            return decodeBinary(element);
        }
        String[] strings = getStrings(tag);
        double[] values = new double[strings.length];
        for (int i = 0; i < strings.length; i++) {
            try {
                values[i] = Double.parseDouble(strings[i]);
            } catch (NumberFormatException e) {
                values[i] = Double.NaN;
            }
        }
        return values;
    }

    public byte[] getBytes(int tag) {
        DicomElement element = elements.get(tag);
        return element != null ? element.getValue() : null;
    }

    // ------------------------------------------------------------------
    // Sequences
    // ------------------------------------------------------------------

    public List<DicomDataset> getSequence(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || !element.isSequence()) {
            return Collections.emptyList();
        }
        return element.getItems();
    }

    /**
     * First item of a sequence, or null when the sequence is absent or empty.
     */
    public DicomDataset getNestedDataset(int tag) {
        List<DicomDataset> items = getSequence(tag);
        return items.isEmpty() ? null : items.get(0);
    }

    // ------------------------------------------------------------------
    // Mutation
    // ------------------------------------------------------------------

    public void putString(int tag, String vr, String... values) {
        byte[] bytes = String.join("\\", values).getBytes(charset);
        if (bytes.length % 2 != 0) {
            byte[] padded = new byte[bytes.length + 1];
            System.arraycopy(bytes, 0, padded, 0, bytes.length);
            padded[bytes.length] = "UI".equals(vr) ? 0 : (byte) ' ';
            bytes = padded;
        }
        put(new DicomElement(tag, vr, bytes, false));
        if (tag == DicomTag.SpecificCharacterSet) {
            updateCharset();
        }
    }

    public void putUnsignedShorts(int tag, int... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int value : values) {
            buffer.putShort((short) value);
        }
        put(new DicomElement(tag, "US", buffer.array(), false));
    }

    public void putBytes(int tag, String vr, byte[] value) {
        put(new DicomElement(tag, vr, value, false));
    }

    public void putSequence(int tag, List<DicomDataset> items) {
        put(new DicomElement(tag, new ArrayList<>(items)));
    }

    void put(DicomElement element) {
        elements.put(element.getTag(), element);
        if (element.getTag() == DicomTag.SpecificCharacterSet) {
            updateCharset();
        }
    }

    void setCharset(Charset charset) {
        this.charset = charset;
    }

    Charset getCharset() {
        return charset;
    }

    public void remove(int tag) {
        elements.remove(tag);
    }

    // ------------------------------------------------------------------
    // Decoding helpers
    // ------------------------------------------------------------------

    private void updateCharset() {
        DicomElement element = elements.get(DicomTag.SpecificCharacterSet);
        String value = element != null
                ? new String(element.getValue(), StandardCharsets.US_ASCII).trim()
                : "";
        charset = value.contains("ISO_IR 192") ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1;
    }

    private String decodeText(byte[] value) {
        int end = value.length;
        while (end > 0 && (value[end - 1] == 0 || value[end - 1] == ' ')) {
            end--;
        }
        return new String(value, 0, end, charset);
    }

    static boolean isBinaryNumeric(String vr) {
        switch (vr) {
            case "US":
            case "SS":
            case "UL":
            case "SL":
            case "FL":
            case "FD":
                return true;
            default:
                return false;
        }
    }

    static boolean isText(String vr) {
        return TEXT_VRS.contains(vr);
    }

    private static double[] decodeBinary(DicomElement element) {
        ByteBuffer buffer = ByteBuffer.wrap(element.getValue()).order(ByteOrder.LITTLE_ENDIAN);
        int width;
        switch (element.getVr()) {
            case "US":
            case "SS":
                width = 2;
                break;
            case "FD":
                width = 8;
                break;
            default:
                width = 4;
                break;
        }
        double[] values = new double[buffer.remaining() / width];
        for (int i = 0; i < values.length; i++) {
            switch (element.getVr()) {
                case "US":
                    values[i] = buffer.getShort() & 0xFFFF;
                    break;
                case "SS":
                    values[i] = buffer.getShort();
                    break;
                case "UL":
                    values[i] = buffer.getInt() & 0xFFFFFFFFL;
                    break;
                case "SL":
                    values[i] = buffer.getInt();
                    break;
                case "FL":
                    values[i] = buffer.getFloat();
                    break;
                default:
                    values[i] = buffer.getDouble();
                    break;
            }
        }
        return values;
    }

    private static String formatNumber(double value) {
        if (value == Math.floor(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
