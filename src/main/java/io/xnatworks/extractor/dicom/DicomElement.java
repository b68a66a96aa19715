/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.util.Collections;
import java.util.List;

/**
 * A single data element: tag, value representation and either a raw little-endian
 * value or the items of a sequence.
 */
public final class DicomElement {

    private final int tag;
    private final String vr;
    private final byte[] value;
    private final List<DicomDataset> items;
    private final boolean encapsulated;

    DicomElement(int tag, String vr, byte[] value, boolean encapsulated) {
        this.tag = tag;
        this.vr = vr;
        this.value = value;
        this.items = null;
        this.encapsulated = encapsulated;
    }

    DicomElement(int tag, List<DicomDataset> items) {
        this.tag = tag;
        this.vr = "SQ";
        this.value = null;
        this.items = items;
        this.encapsulated = false;
    }

    public int getTag() { return tag; }
    public String getVr() { return vr; }

    public boolean isSequence() {
        return items != null;
    }

    /**
     * True when the value holds concatenated compressed fragments rather than native pixels.
     */
    public boolean isEncapsulated() {
        return encapsulated;
    }

    public byte[] getValue() {
        return value != null ? value : new byte[0];
    }

    public List<DicomDataset> getItems() {
        return items != null ? Collections.unmodifiableList(items) : Collections.emptyList();
    }

    @Override
    public String toString() {
        if (isSequence()) {
            return DicomTag.nameOf(tag) + " SQ [" + items.size() + " items]";
        }
        return DicomTag.nameOf(tag) + " " + vr + " [" + getValue().length + " bytes]";
    }
}
