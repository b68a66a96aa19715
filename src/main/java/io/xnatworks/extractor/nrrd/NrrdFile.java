/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.nrrd;

import io.xnatworks.extractor.model.ImageGeometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A parsed NRRD label volume: header fields, key/value pairs and integer sample values.
 *
 * <p>Samples are in file order, the first axis varying fastest. Multi-layer segmentation
 * files written by 3D Slicer have a leading {@code list} axis holding the layers.</p>
 */
public final class NrrdFile {

    private final Map<String, String> fields;
    private final Map<String, String> keyValues;
    private final int[] sizes;
    private final double[][] spaceDirections;
    private final double[] spaceOrigin;
    private final int[] data;

    NrrdFile(Map<String, String> fields, Map<String, String> keyValues, int[] sizes,
             double[][] spaceDirections, double[] spaceOrigin, int[] data) {
        this.fields = Collections.unmodifiableMap(fields);
        this.keyValues = Collections.unmodifiableMap(keyValues);
        this.sizes = sizes;
        this.spaceDirections = spaceDirections;
        this.spaceOrigin = spaceOrigin;
        this.data = data;
    }

    /**
     * Header fields with lower-case names, e.g. {@code type}, {@code space}.
     */
    public Map<String, String> getFields() { return fields; }

    public Map<String, String> getKeyValues() { return keyValues; }

    public int getDimension() { return sizes.length; }
    public int[] getSizes() { return sizes.clone(); }
    public int[] getData() { return data; }

    public String getSpace() {
        return fields.get("space");
    }

    /**
     * Number of label layers: the size of a leading non-spatial axis, or 1.
     */
    public int getLayerCount() {
        return sizes.length == 4 ? sizes[0] : 1;
    }

    /**
     * Label values of one layer, column-fastest like the spatial axes.
     */
    public int[] getLayer(int layer) {
        int layers = getLayerCount();
        if (layer < 0 || layer >= layers) {
            throw new IndexOutOfBoundsException("Layer " + layer + " of " + layers);
        }
        if (layers == 1 && sizes.length == 3) {
            return data;
        }
        int[] values = new int[data.length / layers];
        for (int i = 0; i < values.length; i++) {
            values[i] = data[i * layers + layer];
        }
        return values;
    }

    /**
     * True when the header carries Slicer segment metadata ({@code Segment0_Name} etc.).
     */
    public boolean hasSegmentMetadata() {
        return keyValues.containsKey("Segment0_Name");
    }

    /**
     * Segments declared in the header, in index order.
     */
    public List<SegmentInfo> getSegments() {
        List<SegmentInfo> segments = new ArrayList<>();
        for (int i = 0; keyValues.containsKey("Segment" + i + "_Name"); i++) {
            String prefix = "Segment" + i + "_";
            segments.add(new SegmentInfo(
                    keyValues.get(prefix + "Name"),
                    parseInt(keyValues.get(prefix + "LabelValue"), 1),
                    parseInt(keyValues.get(prefix + "Layer"), 0)));
        }
        return segments;
    }

    /**
     * Sampling grid of the spatial axes in LPS coordinates.
     */
    public ImageGeometry getGeometry() throws NrrdFormatException {
        int first = sizes.length - 3;
        if (first < 0) {
            throw new NrrdFormatException("Expected 3 spatial axes, found dimension " + sizes.length);
        }

        int[] size = {sizes[first], sizes[first + 1], sizes[first + 2]};
        double[] spacing = {1, 1, 1};
        double[] direction = {1, 0, 0, 0, 1, 0, 0, 0, 1};
        double[] origin = spaceOrigin != null ? spaceOrigin.clone() : new double[3];

        if (spaceDirections != null) {
            for (int a = 0; a < 3; a++) {
                double[] vector = spaceDirections[first + a];
                if (vector == null || vector.length != 3) {
                    throw new NrrdFormatException("Spatial axis " + a + " has no space direction");
                }
                double norm = Math.sqrt(vector[0] * vector[0] + vector[1] * vector[1] + vector[2] * vector[2]);
                if (norm == 0) {
                    throw new NrrdFormatException("Zero-length space direction on axis " + a);
                }
                spacing[a] = norm;
                for (int r = 0; r < 3; r++) {
                    direction[r * 3 + a] = vector[r] / norm;
                }
            }
        }

        if (isRas(getSpace())) {
            origin[0] = -origin[0];
            origin[1] = -origin[1];
            for (int a = 0; a < 3; a++) {
                direction[a] = -direction[a];
                direction[3 + a] = -direction[3 + a];
            }
        }
        try {
            return new ImageGeometry(size, spacing, origin, direction);
        } catch (IllegalArgumentException e) {
            throw new NrrdFormatException("Invalid NRRD geometry: " + e.getMessage(), e);
        }
    }

    private static boolean isRas(String space) {
        return space != null && (space.equalsIgnoreCase("right-anterior-superior") || space.equalsIgnoreCase("RAS"));
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Name, label value and layer of one Slicer segment.
     */
    public static final class SegmentInfo {
        private final String name;
        private final int labelValue;
        private final int layer;

        public SegmentInfo(String name, int labelValue, int layer) {
            this.name = name;
            this.labelValue = labelValue;
            this.layer = layer;
        }

        public String getName() { return name; }
        public int getLabelValue() { return labelValue; }
        public int getLayer() { return layer; }
    }
}
