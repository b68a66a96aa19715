/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

/**
 * SOP classes the extractor treats specially.
 */
public final class SopClass {

    public static final String SEGMENTATION_STORAGE = "1.2.840.10008.5.1.4.1.1.66.4";
    public static final String RT_STRUCTURE_SET_STORAGE = "1.2.840.10008.5.1.4.1.1.481.3";

    private SopClass() {
    }

    public static boolean isSegmentation(DicomDataset dataset) {
        return SEGMENTATION_STORAGE.equals(dataset.getString(DicomTag.SOPClassUID))
                || "SEG".equals(dataset.getString(DicomTag.Modality));
    }

    public static boolean isStructureSet(DicomDataset dataset) {
        return RT_STRUCTURE_SET_STORAGE.equals(dataset.getString(DicomTag.SOPClassUID))
                || "RTSTRUCT".equals(dataset.getString(DicomTag.Modality));
    }
}
