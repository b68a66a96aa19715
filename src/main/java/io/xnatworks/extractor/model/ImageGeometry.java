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
 * Sampling grid of a 3-D volume in patient (LPS) coordinates.
 *
 * <p>Axis 0 runs along image columns, axis 1 along rows and axis 2 across slices.
 * {@code direction} is a row-major 3x3 matrix whose columns are the unit vectors of
 * the three axes, so that
 * {@code physical = origin + direction * (i * spacing[0], j * spacing[1], k * spacing[2])}.</p>
 */
public final class ImageGeometry {

    public static final double TOLERANCE = 1e-3;

    private final int[] size;
    private final double[] spacing;
    private final double[] origin;
    private final double[] direction;
    private final double[] inverse;

    public ImageGeometry(int[] size, double[] spacing, double[] origin, double[] direction) {
        if (size.length != 3 || spacing.length != 3 || origin.length != 3 || direction.length != 9) {
            throw new IllegalArgumentException("Geometry needs 3 sizes, 3 spacings, 3 origin values and 9 direction values");
        }
        for (int i = 0; i < 3; i++) {
            if (size[i] <= 0) {
                throw new IllegalArgumentException("Size must be positive: " + Arrays.toString(size));
            }
            if (!(spacing[i] > 0)) {
                throw new IllegalArgumentException("Spacing must be positive: " + Arrays.toString(spacing));
            }
        }
        this.size = size.clone();
        this.spacing = spacing.clone();
        this.origin = origin.clone();
        this.direction = direction.clone();
        this.inverse = invert(direction);
    }

    public static ImageGeometry identity(int columns, int rows, int slices) {
        return new ImageGeometry(new int[]{columns, rows, slices}, new double[]{1, 1, 1},
                new double[3], new double[]{1, 0, 0, 0, 1, 0, 0, 0, 1});
    }

    public int[] getSize() { return size.clone(); }
    public double[] getSpacing() { return spacing.clone(); }
    public double[] getOrigin() { return origin.clone(); }
    public double[] getDirection() { return direction.clone(); }

    public int getColumns() { return size[0]; }
    public int getRows() { return size[1]; }
    public int getSlices() { return size[2]; }

    public int getVoxelCount() {
        return size[0] * size[1] * size[2];
    }

    /**
     * Array shape in C order: slices, rows, columns.
     */
    public int[] getShape() {
        return new int[]{size[2], size[1], size[0]};
    }

    public int index(int i, int j, int k) {
        return i + size[0] * (j + size[1] * k);
    }

    public boolean contains(int i, int j, int k) {
        return i >= 0 && j >= 0 && k >= 0 && i < size[0] && j < size[1] && k < size[2];
    }

    public double[] indexToPhysical(double i, double j, double k) {
        double x = i * spacing[0];
        double y = j * spacing[1];
        double z = k * spacing[2];
        return new double[]{
                origin[0] + direction[0] * x + direction[1] * y + direction[2] * z,
                origin[1] + direction[3] * x + direction[4] * y + direction[5] * z,
                origin[2] + direction[6] * x + direction[7] * y + direction[8] * z
        };
    }

    /**
     * Continuous index of a physical point; round to get the nearest voxel.
     */
    public double[] physicalToIndex(double[] point) {
        double dx = point[0] - origin[0];
        double dy = point[1] - origin[1];
        double dz = point[2] - origin[2];
        return new double[]{
                (inverse[0] * dx + inverse[1] * dy + inverse[2] * dz) / spacing[0],
                (inverse[3] * dx + inverse[4] * dy + inverse[5] * dz) / spacing[1],
                (inverse[6] * dx + inverse[7] * dy + inverse[8] * dz) / spacing[2]
        };
    }

    /**
     * Sub-grid covering {@code [lower, upper)} in index space.
     */
    public ImageGeometry crop(int[] lower, int[] upper) {
        int[] newSize = new int[3];
        for (int a = 0; a < 3; a++) {
            if (lower[a] < 0 || upper[a] > size[a] || upper[a] <= lower[a]) {
                throw new IllegalArgumentException("Crop box [" + Arrays.toString(lower) + ", "
                        + Arrays.toString(upper) + ") outside " + Arrays.toString(size));
            }
            newSize[a] = upper[a] - lower[a];
        }
        return new ImageGeometry(newSize, spacing, indexToPhysical(lower[0], lower[1], lower[2]), direction);
    }

    /**
     * Same size and, within {@link #TOLERANCE}, the same spacing, origin and direction.
     */
    public boolean isCongruent(ImageGeometry other) {
        return Arrays.equals(size, other.size)
                && close(spacing, other.spacing)
                && close(origin, other.origin)
                && close(direction, other.direction);
    }

    private static boolean close(double[] a, double[] b) {
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    private static double[] invert(double[] m) {
        double c00 = m[4] * m[8] - m[5] * m[7];
        double c01 = m[5] * m[6] - m[3] * m[8];
        double c02 = m[3] * m[7] - m[4] * m[6];
        double det = m[0] * c00 + m[1] * c01 + m[2] * c02;
        if (Math.abs(det) < 1e-12) {
            throw new IllegalArgumentException("Direction matrix is singular: " + Arrays.toString(m));
        }
        return new double[]{
                c00 / det, (m[2] * m[7] - m[1] * m[8]) / det, (m[1] * m[5] - m[2] * m[4]) / det,
                c01 / det, (m[0] * m[8] - m[2] * m[6]) / det, (m[2] * m[3] - m[0] * m[5]) / det,
                c02 / det, (m[1] * m[6] - m[0] * m[7]) / det, (m[0] * m[4] - m[1] * m[3]) / det
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageGeometry)) return false;
        ImageGeometry that = (ImageGeometry) o;
        return Arrays.equals(size, that.size)
                && Arrays.equals(spacing, that.spacing)
                && Arrays.equals(origin, that.origin)
                && Arrays.equals(direction, that.direction);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(size);
        result = 31 * result + Arrays.hashCode(spacing);
        result = 31 * result + Arrays.hashCode(origin);
        result = 31 * result + Arrays.hashCode(direction);
        return result;
    }

    @Override
    public String toString() {
        return "ImageGeometry{size=" + Arrays.toString(size)
                + ", spacing=" + Arrays.toString(spacing)
                + ", origin=" + Arrays.toString(origin) + "}";
    }
}
