/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

import java.util.Arrays;

/**
 * Binary mask on an image grid, one byte per voxel (0 or 1), same voxel order as {@link Volume}.
 */
public final class Mask {

    private final ImageGeometry geometry;
    private final byte[] data;

    public Mask(ImageGeometry geometry, byte[] data) {
        if (data.length != geometry.getVoxelCount()) {
            throw new IllegalArgumentException("Mask data has " + data.length
                    + " voxels, geometry needs " + geometry.getVoxelCount());
        }
        this.geometry = geometry;
        this.data = data;
    }

    public static Mask empty(ImageGeometry geometry) {
        return new Mask(geometry, new byte[geometry.getVoxelCount()]);
    }

    public ImageGeometry getGeometry() { return geometry; }

    /**
     * Backing array, not copied.
     */
    public byte[] getData() { return data; }

    public int[] getShape() {
        return geometry.getShape();
    }

    public boolean isSet(int i, int j, int k) {
        return data[geometry.index(i, j, k)] != 0;
    }

    public void set(int i, int j, int k) {
        data[geometry.index(i, j, k)] = 1;
    }

    public int count() {
        int count = 0;
        for (byte b : data) {
            if (b != 0) {
                count++;
            }
        }
        return count;
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    /**
     * Voxel-wise logical OR. Both masks must share the same grid size.
     */
    public Mask or(Mask other) {
        if (other.data.length != data.length || !Arrays.equals(other.geometry.getSize(), geometry.getSize())) {
            throw new IllegalArgumentException("Cannot merge masks of different size: "
                    + geometry + " and " + other.geometry);
        }
        byte[] merged = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            merged[i] = (byte) ((data[i] | other.data[i]) != 0 ? 1 : 0);
        }
        return new Mask(geometry, merged);
    }
}
