/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.locate;

import io.xnatworks.extractor.dicom.DicomFileReader;
import io.xnatworks.extractor.nrrd.NrrdReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers patient folders and the image and segmentation files of each.
 */
public class PatientLocator {
    private static final Logger log = LoggerFactory.getLogger(PatientLocator.class);

    private final Path patientsDirectory;
    private final Path segmentationsDirectory;
    private final SegmentationFilenameMatcher filenameMatcher;

    /**
     * @param segmentationsDirectory shared segmentation directory, or null when segmentation
     *                               files sit in the patient folders
     */
    public PatientLocator(Path patientsDirectory, Path segmentationsDirectory,
                          SegmentationFilenameMatcher filenameMatcher) {
        this.patientsDirectory = patientsDirectory;
        this.segmentationsDirectory = segmentationsDirectory;
        this.filenameMatcher = filenameMatcher;
    }

    /**
     * Patient folders, sorted by name.
     */
    public List<Path> listPatientDirectories() throws IOException {
        if (!Files.isDirectory(patientsDirectory)) {
            throw new IOException("Directory does not exist: " + patientsDirectory);
        }
        try (Stream<Path> children = Files.list(patientsDirectory)) {
            return children.filter(Files::isDirectory)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Walk one patient folder recursively.
     */
    public PatientLocation locate(Path patientDirectory) throws IOException {
        String patientName = patientDirectory.getFileName().toString();
        List<Path> dicomFiles = new ArrayList<>();
        List<Path> segmentationFiles = new ArrayList<>();

        for (Path file : walk(patientDirectory)) {
            if (NrrdReader.isNrrdFile(file)) {
                segmentationFiles.add(file);
            } else if (DicomFileReader.isDicomFile(file)) {
                dicomFiles.add(file);
            } else {
                log.debug("Skipping non-DICOM file {}", file);
            }
        }

        if (segmentationsDirectory != null) {
            segmentationFiles.addAll(findSharedSegmentations(patientName));
        }

        PatientLocation location = new PatientLocation(patientName, patientDirectory, dicomFiles, segmentationFiles);
        log.debug("Located {}", location);
        return location;
    }

    private List<Path> findSharedSegmentations(String patientName) throws IOException {
        Optional<String> number = filenameMatcher.patientNumber(patientName);
        if (number.isEmpty()) {
            log.warn("Patient folder {} has no number, shared segmentations cannot be matched", patientName);
            return List.of();
        }
        List<Path> matches = new ArrayList<>();
        for (Path file : walk(segmentationsDirectory)) {
            String fileName = file.getFileName().toString();
            if (filenameMatcher.belongsToPatient(fileName, number.get())
                    && (NrrdReader.isNrrdFile(file) || DicomFileReader.isDicomFile(file))) {
                matches.add(file);
            }
        }
        log.debug("Found {} shared segmentation files for {}", matches.size(), patientName);
        return matches;
    }

    private static List<Path> walk(Path directory) throws IOException {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
