/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.series;

import io.xnatworks.extractor.model.ImageSeries;
import io.xnatworks.extractor.model.Volume;

import java.io.IOException;

/**
 * Reconstructs the voxel array of a grouped series, slices in the series' order.
 */
public interface VolumeReader {

    Volume read(ImageSeries series) throws IOException;
}
