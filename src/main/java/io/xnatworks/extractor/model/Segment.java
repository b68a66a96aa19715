/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

/**
 * One raw labelled mask from a segmentation, before alias resolution.
 */
public final class Segment {

    private final String label;
    private final Mask mask;

    public Segment(String label, Mask mask) {
        this.label = label;
        this.mask = mask;
    }

    public String getLabel() { return label; }
    public Mask getMask() { return mask; }

    @Override
    public String toString() {
        return "Segment{" + label + ", " + mask.count() + " voxels}";
    }
}
