/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.extract;

import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.FailureRecord;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExtractionReport.
 */
@DisplayName("ExtractionReport Tests")
class ExtractionReportTest {

    @TempDir
    Path tempDir;

    private ExtractionReport report() {
        FailureRecord missing = new FailureRecord("P2", FailureReason.MISSING_CRITERION, "No series for PT");
        missing.setMissingCriteria(List.of("PT"));
        missing.setAvailableDescriptions(List.of("CT 3mm", "PET NAC"));

        ExtractionReport report = new ExtractionReport();
        report.setStartedAt(Instant.parse("2025-03-01T10:00:00Z"));
        report.setFinishedAt(Instant.parse("2025-03-01T10:05:00Z"));
        report.setDatabase("patients.db");
        report.setPatientsFound(3);
        report.setPatientsWritten(2);
        report.setPatientsFailed(List.of("P3"));
        report.setFailures(List.of(missing));
        report.setMatchCriteria(Map.of("CT", List.of("CT 3mm")));
        return report;
    }

    @Test
    @DisplayName("Should read back what it wrote")
    void shouldReadBackWrittenReport() throws IOException {
        Path file = tempDir.resolve("reports/run.json");

        report().writeTo(file);
        ExtractionReport read = ExtractionReport.read(file);

        assertEquals(Instant.parse("2025-03-01T10:00:00Z"), read.getStartedAt());
        assertEquals(3, read.getPatientsFound());
        assertEquals(2, read.getPatientsWritten());
        assertEquals(List.of("P3"), read.getPatientsFailed());
        assertEquals(Map.of("CT", List.of("CT 3mm")), read.getMatchCriteria());
        FailureRecord failure = read.getFailures().get(0);
        assertEquals(FailureReason.MISSING_CRITERION, failure.getReason());
        assertEquals(List.of("CT 3mm", "PET NAC"), failure.getAvailableDescriptions());
    }

    @Test
    @DisplayName("Should write snake_case keys and ISO timestamps")
    void shouldWriteReadableJson() throws IOException {
        Path file = tempDir.resolve("run.json");

        report().writeTo(file);
        String json = Files.readString(file);

        assertTrue(json.contains("\"patients_failed\""));
        assertTrue(json.contains("\"missing_criteria\""));
        assertTrue(json.contains("\"2025-03-01T10:00:00Z\""));
    }

    @Test
    @DisplayName("Should ignore unknown keys")
    void shouldIgnoreUnknownKeys() throws IOException {
        Path file = tempDir.resolve("old.json");
        Files.writeString(file, "{\"patients_found\": 4, \"legacy\": true}");

        assertEquals(4, ExtractionReport.read(file).getPatientsFound());
    }
}
