/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.series;

import io.xnatworks.extractor.dicom.DicomDataset;
import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.model.ImageSeries;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of {@link SeriesGrouper#group}: the image series of a patient folder, the DICOM
 * segmentation objects found next to them and the problems met on the way.
 *
 * <p>Failure records carry no patient identifier yet; the caller fills it in once the
 * patient is known.</p>
 */
public class GroupingResult {

    private final List<ImageSeries> series = new ArrayList<>();
    private final Map<Path, DicomDataset> segmentationObjects = new LinkedHashMap<>();
    private final Set<String> patientIds = new LinkedHashSet<>();
    private final List<FailureRecord> failures = new ArrayList<>();
    private int readableFiles;

    public List<ImageSeries> getSeries() { return series; }

    /**
     * Headers of DICOM SEG and RT structure set files, by path.
     */
    public Map<Path, DicomDataset> getSegmentationObjects() { return segmentationObjects; }

    /**
     * Distinct Patient ID values seen in the readable files.
     */
    public Set<String> getPatientIds() { return patientIds; }

    public List<FailureRecord> getFailures() { return failures; }

    public int getReadableFiles() { return readableFiles; }

    void incrementReadableFiles() {
        readableFiles++;
    }
}
