/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.locate;

import io.xnatworks.extractor.dicom.DicomFixtures;
import io.xnatworks.extractor.dicom.DicomTestWriter;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatientLocator.
 */
@DisplayName("PatientLocator Tests")
class PatientLocatorTest {

    @TempDir
    Path tempDir;

    private Path patients;
    private Path segmentations;

    @BeforeEach
    void setUp() throws IOException {
        patients = Files.createDirectories(tempDir.resolve("patients"));
        segmentations = Files.createDirectories(tempDir.resolve("segmentations"));
    }

    @Test
    @DisplayName("Should list patient folders sorted and skip hidden entries")
    void shouldListPatientFolders() throws IOException {
        Files.createDirectories(patients.resolve("Patient2"));
        Files.createDirectories(patients.resolve("Patient1"));
        Files.createDirectories(patients.resolve(".cache"));
        Files.writeString(patients.resolve("README.txt"), "notes");

        PatientLocator locator = new PatientLocator(patients, null, new SegmentationFilenameMatcher("Ano"));
        List<Path> folders = locator.listPatientDirectories();

        assertEquals(List.of(patients.resolve("Patient1"), patients.resolve("Patient2")), folders);
    }

    @Test
    @DisplayName("Should fail when the patients directory is missing")
    void shouldFailForMissingDirectory() {
        PatientLocator locator = new PatientLocator(tempDir.resolve("missing"), null,
                new SegmentationFilenameMatcher("Ano"));

        assertThrows(IOException.class, locator::listPatientDirectories);
    }

    @Test
    @DisplayName("Should classify files in nested folders")
    void shouldClassifyFiles() throws IOException {
        Path folder = patients.resolve("Patient1");
        DicomFixtures.writeSeries(folder.resolve("CT"), "P1", "1.2.3.1", "CT", 2, 2, 2);
        DicomTestWriter.write(DicomFixtures.imageSlice("P1", "1.2.3.2", "MR", 0, 2, 2), folder.resolve("MR/IM0001"));
        Files.writeString(folder.resolve("Ano1_1.2.3.1.nrrd"), "NRRD0004\n");
        Files.writeString(folder.resolve("notes.txt"), "not an image");

        PatientLocation location = new PatientLocator(patients, null, new SegmentationFilenameMatcher("Ano"))
                .locate(folder);

        assertEquals("Patient1", location.getPatientName());
        assertEquals(folder, location.getDirectory());
        assertEquals(3, location.getDicomFiles().size());
        assertEquals(List.of(folder.resolve("Ano1_1.2.3.1.nrrd")), location.getSegmentationFiles());
    }

    @Test
    @DisplayName("Should pick shared segmentations by prefix and patient number")
    void shouldFindSharedSegmentations() throws IOException {
        Path folder = Files.createDirectories(patients.resolve("Patient-12"));
        Files.writeString(segmentations.resolve("Ano12_1.2.3.nrrd"), "NRRD0004\n");
        Files.writeString(segmentations.resolve("Ano12_rtstruct.dcm"), "");
        Files.writeString(segmentations.resolve("Ano123_1.2.3.nrrd"), "NRRD0004\n");
        Files.writeString(segmentations.resolve("Ano12_notes.txt"), "notes");

        PatientLocation location = new PatientLocator(patients, segmentations, new SegmentationFilenameMatcher("Ano"))
                .locate(folder);

        assertEquals(List.of(segmentations.resolve("Ano12_1.2.3.nrrd"), segmentations.resolve("Ano12_rtstruct.dcm")),
                location.getSegmentationFiles());
        assertTrue(location.getDicomFiles().isEmpty());
    }

    @Test
    @DisplayName("Should match zero-padded folder numbers to unpadded file names")
    void shouldMatchZeroPaddedFolders() throws IOException {
        Path folder = Files.createDirectories(patients.resolve("Patient007"));
        Files.writeString(segmentations.resolve("Ano7_1.2.3.nrrd"), "NRRD0004\n");
        Files.writeString(segmentations.resolve("Ano70_1.2.3.nrrd"), "NRRD0004\n");

        PatientLocation location = new PatientLocator(patients, segmentations, new SegmentationFilenameMatcher("Ano"))
                .locate(folder);

        assertEquals(List.of(segmentations.resolve("Ano7_1.2.3.nrrd")), location.getSegmentationFiles());
    }

    @Test
    @DisplayName("Should skip shared segmentations when the folder has no number")
    void shouldSkipUnnumberedFolders() throws IOException {
        Path folder = Files.createDirectories(patients.resolve("PatientX"));
        Files.writeString(segmentations.resolve("Ano1_1.2.3.nrrd"), "NRRD0004\n");

        PatientLocation location = new PatientLocator(patients, segmentations, new SegmentationFilenameMatcher("Ano"))
                .locate(folder);

        assertTrue(location.getSegmentationFiles().isEmpty());
    }
}
