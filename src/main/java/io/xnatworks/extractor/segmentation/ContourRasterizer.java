/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scan-line fill of closed planar polygons given in continuous pixel coordinates.
 *
 * <p>All polygons of one slice are filled together with the even-odd rule, so a contour
 * lying inside another one cuts a hole. A pixel is inside when its centre is.</p>
 */
final class ContourRasterizer {

    private static final double EPSILON = 1e-6;

    private ContourRasterizer() {
    }

    /**
     * @param polygons each polygon as {@code {xs, ys}} with x along columns and y along rows
     * @param offset   index of the slice's first pixel in {@code target}
     */
    static void fill(List<double[][]> polygons, int columns, int rows, byte[] target, int offset) {
        List<Double> crossings = new ArrayList<>();
        for (int row = 0; row < rows; row++) {
            crossings.clear();
            double y = row;
            for (double[][] polygon : polygons) {
                double[] xs = polygon[0];
                double[] ys = polygon[1];
                int n = xs.length;
                for (int a = 0, b = n - 1; a < n; b = a++) {
                    double y0 = ys[b];
                    double y1 = ys[a];
                    if ((y0 <= y && y1 > y) || (y1 <= y && y0 > y)) {
                        crossings.add(xs[b] + (y - y0) * (xs[a] - xs[b]) / (y1 - y0));
                    }
                }
            }
            Collections.sort(crossings);
            for (int c = 0; c + 1 < crossings.size(); c += 2) {
                int from = Math.max(0, (int) Math.ceil(crossings.get(c) - EPSILON));
                int to = Math.min(columns - 1, (int) Math.floor(crossings.get(c + 1) + EPSILON));
                for (int col = from; col <= to; col++) {
                    target[offset + row * columns + col] = 1;
                }
            }
        }
    }
}
