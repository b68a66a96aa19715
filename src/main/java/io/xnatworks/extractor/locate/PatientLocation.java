/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.locate;

import java.nio.file.Path;
import java.util.List;

/**
 * Files found for one patient folder.
 *
 * <p>{@code dicomFiles} holds every DICOM file of the folder, images as well as DICOM SEG and
 * RT structure sets; they are told apart when headers are read. {@code segmentationFiles}
 * holds NRRD label volumes of the folder plus any file of the shared segmentation directory
 * whose name carries the patient number.</p>
 */
public final class PatientLocation {

    private final String patientName;
    private final Path directory;
    private final List<Path> dicomFiles;
    private final List<Path> segmentationFiles;

    public PatientLocation(String patientName, Path directory, List<Path> dicomFiles, List<Path> segmentationFiles) {
        this.patientName = patientName;
        this.directory = directory;
        this.dicomFiles = List.copyOf(dicomFiles);
        this.segmentationFiles = List.copyOf(segmentationFiles);
    }

    public String getPatientName() { return patientName; }
    public Path getDirectory() { return directory; }
    public List<Path> getDicomFiles() { return dicomFiles; }
    public List<Path> getSegmentationFiles() { return segmentationFiles; }

    @Override
    public String toString() {
        return "PatientLocation{" + patientName + ", " + dicomFiles.size() + " DICOM, "
                + segmentationFiles.size() + " segmentation files}";
    }
}
