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
import io.xnatworks.extractor.segmentation.Resampler;

import java.util.Map;

/**
 * Copies the organ masks of a segmented image onto an unsegmented one, for instance a CT
 * contour set onto the PET acquired in the same session. Masks are resampled through patient
 * coordinates with nearest-neighbour interpolation onto the target grid.
 */
public class CopySegmentationsTransform implements RecordTransform {

    private final String segmentedImage;
    private final String unsegmentedImage;

    public CopySegmentationsTransform(String segmentedImage, String unsegmentedImage) {
        if (segmentedImage.equals(unsegmentedImage)) {
            throw new IllegalArgumentException("Source and target image are both '" + segmentedImage + "'");
        }
        this.segmentedImage = segmentedImage;
        this.unsegmentedImage = unsegmentedImage;
    }

    @Override
    public String describe() {
        return "CopySegmentations(from=" + segmentedImage + ", to=" + unsegmentedImage + ")";
    }

    @Override
    public RecordData apply(RecordData data) {
        Map<String, Mask> organs = data.getMasks(segmentedImage);
        data.getImage(segmentedImage);
        ImageGeometry target = data.getImage(unsegmentedImage).getGeometry();

        if (organs.isEmpty()) {
            throw new IllegalStateException("Image '" + segmentedImage + "' has no segmentation to copy");
        }
        if (!data.getMasks(unsegmentedImage).isEmpty()) {
            throw new IllegalStateException("Image '" + unsegmentedImage + "' is already segmented: "
                    + data.getMasks(unsegmentedImage).keySet());
        }

        organs.forEach((organ, mask) -> data.putMask(unsegmentedImage, organ, Resampler.resample(mask, target)));
        return data;
    }
}
