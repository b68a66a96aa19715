/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.transform;

import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.PatientRecord;
import io.xnatworks.extractor.model.RecordEntry;
import io.xnatworks.extractor.model.Volume;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named arrays of one patient record handed to transforms: images by criterion name and,
 * for each image, masks by canonical organ name.
 *
 * <p>Transforms may replace images and masks, add masks and remove masks. Images cannot
 * be added under a criterion the record does not have.</p>
 */
public class RecordData {

    private final Map<String, Volume> images = new LinkedHashMap<>();
    private final Map<String, Map<String, Mask>> masks = new LinkedHashMap<>();

    public static RecordData of(PatientRecord record) {
        RecordData data = new RecordData();
        for (RecordEntry entry : record.getEntries().values()) {
            data.putImage(entry.getCriterion(), entry.getImage());
            entry.getMasks().forEach((organ, mask) -> data.putMask(entry.getCriterion(), organ, mask));
        }
        return data;
    }

    public Map<String, Volume> getImages() {
        return Collections.unmodifiableMap(images);
    }

    public boolean hasImage(String name) {
        return images.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException when the record has no image of that name
     */
    public Volume getImage(String name) {
        Volume image = images.get(name);
        if (image == null) {
            throw new IllegalArgumentException("No image named '" + name + "', available: " + images.keySet());
        }
        return image;
    }

    public void putImage(String name, Volume image) {
        images.put(name, image);
        masks.computeIfAbsent(name, k -> new LinkedHashMap<>());
    }

    public Map<String, Mask> getMasks(String imageName) {
        Map<String, Mask> organs = masks.get(imageName);
        return organs != null ? Collections.unmodifiableMap(organs) : Collections.emptyMap();
    }

    public void putMask(String imageName, String organ, Mask mask) {
        if (!images.containsKey(imageName)) {
            throw new IllegalArgumentException("No image named '" + imageName + "' to attach organ " + organ + " to");
        }
        masks.get(imageName).put(organ, mask);
    }

    public void removeMask(String imageName, String organ) {
        Map<String, Mask> organs = masks.get(imageName);
        if (organs != null) {
            organs.remove(organ);
        }
    }
}
