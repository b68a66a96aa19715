/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.transform;

import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.Volume;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Crops a reference image to the bounding box of its foreground (voxels greater than zero)
 * and applies the same crop to the matching images. Masks attached to a cropped image are
 * cropped with it.
 */
public class MatchingCropForegroundTransform implements RecordTransform {

    private final String referenceImage;
    private final List<String> matchingImages;

    public MatchingCropForegroundTransform(String referenceImage, List<String> matchingImages) {
        this.referenceImage = referenceImage;
        this.matchingImages = List.copyOf(matchingImages);
    }

    @Override
    public String describe() {
        return "MatchingCropForeground(reference=" + referenceImage + ", matching=" + matchingImages + ")";
    }

    @Override
    public RecordData apply(RecordData data) {
        Volume reference = data.getImage(referenceImage);
        ImageGeometry geometry = reference.getGeometry();
        int[][] box = foregroundBox(reference);
        if (box == null) {
            throw new IllegalStateException("Image '" + referenceImage + "' has no foreground to crop to");
        }

        List<String> names = new ArrayList<>();
        names.add(referenceImage);
        for (String name : matchingImages) {
            if (!names.contains(name)) {
                names.add(name);
            }
        }

        for (String name : names) {
            Volume image = data.getImage(name);
            if (!image.getGeometry().isCongruent(geometry)) {
                throw new IllegalArgumentException("Image '" + name + "' does not share the grid of '"
                        + referenceImage + "': " + image.getGeometry() + " vs " + geometry);
            }
            data.putImage(name, crop(image, box[0], box[1]));
            Map<String, Mask> organs = new LinkedHashMap<>(data.getMasks(name));
            organs.forEach((organ, mask) -> data.putMask(name, organ, crop(mask, box[0], box[1])));
        }
        return data;
    }

    /**
     * @return {lower, upperExclusive} in index space, or null when no voxel is positive
     */
    static int[][] foregroundBox(Volume image) {
        int[] size = image.getGeometry().getSize();
        int[] lower = {Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE};
        int[] upper = {-1, -1, -1};
        float[] voxels = image.getData();
        int n = 0;
        for (int k = 0; k < size[2]; k++) {
            for (int j = 0; j < size[1]; j++) {
                for (int i = 0; i < size[0]; i++, n++) {
                    if (voxels[n] > 0) {
                        lower[0] = Math.min(lower[0], i);
                        lower[1] = Math.min(lower[1], j);
                        lower[2] = Math.min(lower[2], k);
                        upper[0] = Math.max(upper[0], i + 1);
                        upper[1] = Math.max(upper[1], j + 1);
                        upper[2] = Math.max(upper[2], k + 1);
                    }
                }
            }
        }
        return upper[0] < 0 ? null : new int[][]{lower, upper};
    }

    static Volume crop(Volume image, int[] lower, int[] upper) {
        ImageGeometry source = image.getGeometry();
        ImageGeometry target = source.crop(lower, upper);
        float[] out = new float[target.getVoxelCount()];
        float[] in = image.getData();
        int width = target.getColumns();
        for (int k = 0; k < target.getSlices(); k++) {
            for (int j = 0; j < target.getRows(); j++) {
                System.arraycopy(in, source.index(lower[0], lower[1] + j, lower[2] + k),
                        out, target.index(0, j, k), width);
            }
        }
        return new Volume(target, out);
    }

    static Mask crop(Mask mask, int[] lower, int[] upper) {
        ImageGeometry source = mask.getGeometry();
        ImageGeometry target = source.crop(lower, upper);
        byte[] out = new byte[target.getVoxelCount()];
        byte[] in = mask.getData();
        int width = target.getColumns();
        for (int k = 0; k < target.getSlices(); k++) {
            for (int j = 0; j < target.getRows(); j++) {
                System.arraycopy(in, source.index(lower[0], lower[1] + j, lower[2] + k),
                        out, target.index(0, j, k), width);
            }
        }
        return new Mask(target, out);
    }
}
