/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.Mask;

/**
 * Nearest-neighbour resampling between grids, through patient coordinates.
 * Target voxels that fall outside the source grid get 0.
 */
public final class Resampler {

    private Resampler() {
    }

    public static int[] resampleLabels(ImageGeometry source, int[] labels, ImageGeometry target) {
        if (source.isCongruent(target)) {
            return labels.clone();
        }
        int[] result = new int[target.getVoxelCount()];
        Mapping mapping = new Mapping(source, target);
        int[] sourceSize = source.getSize();
        int[] targetSize = target.getSize();
        int n = 0;
        for (int k = 0; k < targetSize[2]; k++) {
            for (int j = 0; j < targetSize[1]; j++) {
                for (int i = 0; i < targetSize[0]; i++, n++) {
                    int si = nearest(mapping.x(i, j, k));
                    int sj = nearest(mapping.y(i, j, k));
                    int sk = nearest(mapping.z(i, j, k));
                    if (si >= 0 && sj >= 0 && sk >= 0 && si < sourceSize[0] && sj < sourceSize[1] && sk < sourceSize[2]) {
                        result[n] = labels[source.index(si, sj, sk)];
                    }
                }
            }
        }
        return result;
    }

    public static Mask resample(Mask mask, ImageGeometry target) {
        if (mask.getGeometry().isCongruent(target)) {
            return new Mask(target, mask.getData().clone());
        }
        byte[] data = mask.getData();
        int[] labels = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            labels[i] = data[i] != 0 ? 1 : 0;
        }
        int[] resampled = resampleLabels(mask.getGeometry(), labels, target);
        byte[] out = new byte[resampled.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) resampled[i];
        }
        return new Mask(target, out);
    }

    static int nearest(double index) {
        return (int) Math.floor(index + 0.5);
    }

    /**
     * Affine map from target indices to continuous source indices.
     */
    private static final class Mapping {
        private final double[] base;
        private final double[] di;
        private final double[] dj;
        private final double[] dk;

        Mapping(ImageGeometry source, ImageGeometry target) {
            base = source.physicalToIndex(target.indexToPhysical(0, 0, 0));
            di = minus(source.physicalToIndex(target.indexToPhysical(1, 0, 0)), base);
            dj = minus(source.physicalToIndex(target.indexToPhysical(0, 1, 0)), base);
            dk = minus(source.physicalToIndex(target.indexToPhysical(0, 0, 1)), base);
        }

        double x(int i, int j, int k) {
            return base[0] + i * di[0] + j * dj[0] + k * dk[0];
        }

        double y(int i, int j, int k) {
            return base[1] + i * di[1] + j * dj[1] + k * dk[1];
        }

        double z(int i, int j, int k) {
            return base[2] + i * di[2] + j * dj[2] + k * dk[2];
        }

        private static double[] minus(double[] a, double[] b) {
            return new double[]{a[0] - b[0], a[1] - b[1], a[2] - b[2]};
        }
    }
}
