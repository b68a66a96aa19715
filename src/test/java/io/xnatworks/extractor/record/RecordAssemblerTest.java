/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.record;

import io.xnatworks.extractor.config.MatchCriteria;
import io.xnatworks.extractor.dicom.DicomDataset;
import io.xnatworks.extractor.match.DescriptionMatcher;
import io.xnatworks.extractor.match.MatchSelection;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.ImageSeries;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.PatientRecord;
import io.xnatworks.extractor.model.Segmentation;
import io.xnatworks.extractor.model.Volume;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RecordAssembler.
 */
@DisplayName("RecordAssembler Tests")
class RecordAssemblerTest {

    private static final ImageGeometry GRID = ImageGeometry.identity(2, 1, 1);

    private final RecordAssembler assembler = new RecordAssembler();
    private final List<FailureRecord> failures = new ArrayList<>();
    private final Map<String, Volume> images = new HashMap<>();

    private DescriptionMatcher matcher;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("CT", List.of("CT 3mm"));
        values.put("PT", List.of("PET AC"));
        matcher = new DescriptionMatcher(MatchCriteria.of(values));
    }

    private ImageSeries series(String uid, String description) {
        ImageSeries series = new ImageSeries(uid, description, List.of(), Map.of(), new DicomDataset(), GRID);
        images.put(uid, new Volume(GRID, new float[]{1, 2}));
        return series;
    }

    private static Segmentation segmentation(String uid, String organ, byte... mask) {
        Map<String, Mask> organs = new LinkedHashMap<>();
        if (organ != null) {
            organs.put(organ, new Mask(GRID, mask));
        }
        return new Segmentation(uid, organs, List.of(Path.of(uid + ".dcm")));
    }

    private List<FailureReason> reasons() {
        List<FailureReason> reasons = new ArrayList<>();
        failures.forEach(f -> reasons.add(f.getReason()));
        return reasons;
    }

    @Test
    @DisplayName("Should attach segmentations to the series they reference")
    void shouldAttachSegmentations() {
        MatchSelection selection = matcher.select(List.of(series("1.1", "CT 3mm"), series("1.2", "PET AC")));

        Optional<PatientRecord> record = assembler.assemble("P1", "Patient1", selection, images,
                List.of(segmentation("1.1", "Prostate", (byte) 1, (byte) 0)), failures);

        assertTrue(record.isPresent());
        assertEquals(List.of("CT", "PT"), record.get().getCriterionNames());
        assertEquals("Patient1", record.get().getPatientName());
        assertTrue(record.get().getEntry("CT").hasSegmentation());
        assertArrayEquals(new byte[]{1, 0}, record.get().getEntry("CT").getMasks().get("Prostate").getData());
        assertFalse(record.get().getEntry("PT").hasSegmentation());
        assertTrue(failures.isEmpty());
    }

    @Test
    @DisplayName("Should merge several segmentations of one series")
    void shouldMergeSegmentations() {
        MatchSelection selection = matcher.select(List.of(series("1.1", "CT 3mm"), series("1.2", "PET AC")));

        PatientRecord record = assembler.assemble("P1", "Patient1", selection, images, List.of(
                segmentation("1.1", "Prostate", (byte) 1, (byte) 0),
                segmentation("1.1", "Prostate", (byte) 0, (byte) 1),
                segmentation("1.1", "Rectum", (byte) 0, (byte) 1)), failures).orElseThrow();

        Map<String, Mask> masks = record.getEntry("CT").getMasks();
        assertArrayEquals(new byte[]{1, 1}, masks.get("Prostate").getData());
        assertEquals(List.of("Prostate", "Rectum"), List.copyOf(masks.keySet()));
        assertEquals(3, record.getEntry("CT").getSegmentation().getSources().size());
    }

    @Test
    @DisplayName("Should not attach segmentations without organs")
    void shouldSkipEmptySegmentations() {
        MatchSelection selection = matcher.select(List.of(series("1.1", "CT 3mm"), series("1.2", "PET AC")));

        PatientRecord record = assembler.assemble("P1", "Patient1", selection, images,
                List.of(segmentation("1.1", null)), failures).orElseThrow();

        assertFalse(record.getEntry("CT").hasSegmentation());
    }

    @Test
    @DisplayName("Should report segmentations of series outside the record")
    void shouldReportOrphans() {
        MatchSelection selection = matcher.select(List.of(series("1.1", "CT 3mm"), series("1.2", "PET AC")));

        assembler.assemble("P1", "Patient1", selection, images,
                List.of(segmentation("7.7", "Prostate", (byte) 1, (byte) 1)), failures);

        assertEquals(List.of(FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE), reasons());
        assertEquals("P1", failures.get(0).getPatientId());
    }

    @Test
    @DisplayName("Should keep the first series and report duplicates")
    void shouldReportDuplicates() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("CT", List.of("CT 3mm", "CT 1mm"));
        MatchSelection selection = new DescriptionMatcher(MatchCriteria.of(values))
                .select(List.of(series("1.1", "CT 3mm"), series("1.2", "CT 1mm")));

        PatientRecord record = assembler.assemble("P1", "Patient1", selection, images, List.of(), failures)
                .orElseThrow();

        assertEquals("1.1", record.getEntry("CT").getSeries().getSeriesInstanceUid());
        assertEquals(List.of(FailureReason.DUPLICATE_CRITERION_MATCH), reasons());
    }

    @Test
    @DisplayName("Should report missing criteria with the available descriptions")
    void shouldReportMissingCriteria() {
        MatchSelection selection = matcher.select(List.of(series("1.1", "CT 3mm"), series("1.2", "PET NAC")));

        PatientRecord record = assembler.assemble("P1", "Patient1", selection, images, List.of(), failures)
                .orElseThrow();

        assertEquals(List.of("CT"), record.getCriterionNames());
        assertEquals(List.of(FailureReason.MISSING_CRITERION), reasons());
        assertEquals(List.of("PT"), failures.get(0).getMissingCriteria());
        assertEquals(List.of("CT 3mm", "PET NAC"), failures.get(0).getAvailableDescriptions());
    }

    @Test
    @DisplayName("Should produce no record when nothing matches")
    void shouldDropPatientWithoutMatches() {
        MatchSelection selection = matcher.select(List.of(series("1.1", "Scout")));

        Optional<PatientRecord> record = assembler.assemble("P1", "Patient1", selection, images, List.of(), failures);

        assertTrue(record.isEmpty());
        assertEquals(List.of(FailureReason.NO_MATCHING_IMAGES), reasons());
        assertEquals(List.of("CT", "PT"), failures.get(0).getMissingCriteria());
    }

    @Test
    @DisplayName("Should produce no record when no matched series could be read")
    void shouldDropPatientWithoutImages() {
        MatchSelection selection = matcher.select(List.of(series("1.1", "CT 3mm"), series("1.2", "PET AC")));
        images.clear();

        Optional<PatientRecord> record = assembler.assemble("P1", "Patient1", selection, images, List.of(), failures);

        assertTrue(record.isEmpty());
        assertEquals(List.of(FailureReason.NO_MATCHING_IMAGES), reasons());
    }
}
