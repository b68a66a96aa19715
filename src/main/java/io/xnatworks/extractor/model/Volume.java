/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

/**
 * A reconstructed image volume. Voxels are stored column-fastest, slice-slowest.
 */
public final class Volume {

    private final ImageGeometry geometry;
    private final float[] data;

    public Volume(ImageGeometry geometry, float[] data) {
        if (data.length != geometry.getVoxelCount()) {
            throw new IllegalArgumentException("Volume data has " + data.length
                    + " voxels, geometry needs " + geometry.getVoxelCount());
        }
        this.geometry = geometry;
        this.data = data;
    }

    public ImageGeometry getGeometry() { return geometry; }

    /**
     * Backing array, not copied.
     */
    public float[] getData() { return data; }

    public int[] getShape() {
        return geometry.getShape();
    }

    public float get(int i, int j, int k) {
        return data[geometry.index(i, j, k)];
    }
}
