/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.series;

import io.xnatworks.extractor.dicom.DicomDataset;
import io.xnatworks.extractor.dicom.DicomFileReader;
import io.xnatworks.extractor.dicom.DicomFormatException;
import io.xnatworks.extractor.dicom.PixelDataDecoder;
import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.ImageSeries;
import io.xnatworks.extractor.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads native pixel data slice by slice and applies the modality rescale.
 */
public class DicomVolumeReader implements VolumeReader {
    private static final Logger log = LoggerFactory.getLogger(DicomVolumeReader.class);

    @Override
    public Volume read(ImageSeries series) throws IOException {
        ImageGeometry geometry = series.getGeometry();
        int sliceSize = geometry.getColumns() * geometry.getRows();
        List<Path> files = series.getFiles();
        float[] data = new float[geometry.getVoxelCount()];

        for (int k = 0; k < files.size(); k++) {
            DicomDataset dataset = DicomFileReader.read(files.get(k));
            float[] slice = PixelDataDecoder.decode(dataset, true);
            if (slice.length != sliceSize) {
                throw new DicomFormatException("Slice " + files.get(k) + " has " + slice.length
                        + " pixels, series expects " + sliceSize);
            }
            System.arraycopy(slice, 0, data, k * sliceSize, sliceSize);
        }

        log.debug("Read {} slices of series {}", files.size(), series.getSeriesInstanceUid());
        return new Volume(geometry, data);
    }
}
