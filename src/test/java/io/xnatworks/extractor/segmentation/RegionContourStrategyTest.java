/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.dicom.DicomFileReader;
import io.xnatworks.extractor.dicom.DicomFixtures;
import io.xnatworks.extractor.dicom.DicomTestWriter;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.series.SeriesGrouper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RegionContourStrategy.
 */
@DisplayName("RegionContourStrategy Tests")
class RegionContourStrategyTest {

    private static final String SERIES_UID = "1.2.826.0.1.3680043.8.498.20";

    @TempDir
    Path tempDir;

    private ResolutionContext context;
    private final RegionContourStrategy strategy = new RegionContourStrategy();

    @BeforeEach
    void setUp() throws IOException {
        List<Path> files = DicomFixtures.writeSeries(tempDir.resolve("ct"), "P1", SERIES_UID, "CT", 6, 6, 3);
        context = new ResolutionContext("P1", new SeriesGrouper().group(files).getSeries());
    }

    private SegmentationSource write(Map<String, List<double[]>> contours) throws IOException {
        Path file = DicomTestWriter.write(DicomFixtures.structureSet("P1", SERIES_UID, contours),
                tempDir.resolve("rtstruct.dcm"));
        return SegmentationSource.dicom(file, DicomFileReader.readHeader(file));
    }

    @Test
    @DisplayName("Should rasterize closed contours onto their nearest slice")
    void shouldRasterizeContours() throws Exception {
        Map<String, List<double[]>> contours = new LinkedHashMap<>();
        contours.put("Prostate", List.of(DicomFixtures.square(1.5, 1.5, 4.5, 4.5, 1)));
        contours.put("Rectum", List.of(DicomFixtures.square(-0.5, -0.5, 0.5, 0.5, 2)));
        SegmentationSource source = write(contours);

        assertTrue(strategy.accepts(source));
        RawSegmentation raw = strategy.resolve(source, context);

        assertEquals(SERIES_UID, raw.getReferencedSeriesUid());
        assertEquals(SegmentationFormat.REGION_CONTOUR, raw.getFormat());
        assertEquals(List.of("Prostate", "Rectum"),
                List.of(raw.getSegments().get(0).getLabel(), raw.getSegments().get(1).getLabel()));

        Mask prostate = raw.getSegments().get(0).getMask();
        assertEquals(9, prostate.count());
        assertTrue(prostate.isSet(2, 2, 1));
        assertTrue(prostate.isSet(4, 4, 1));
        assertFalse(prostate.isSet(2, 2, 0));
        assertFalse(prostate.isSet(5, 2, 1));

        Mask rectum = raw.getSegments().get(1).getMask();
        assertEquals(1, rectum.count());
        assertTrue(rectum.isSet(0, 0, 2));
    }

    @Test
    @DisplayName("Should combine contours of one slice with the even-odd rule")
    void shouldCutHoles() throws Exception {
        SegmentationSource source = write(Map.of("Bladder", List.of(
                DicomFixtures.square(0.5, 0.5, 5.5, 5.5, 0),
                DicomFixtures.square(1.5, 1.5, 4.5, 4.5, 0))));

        Mask bladder = strategy.resolve(source, context).getSegments().get(0).getMask();

        assertEquals(16, bladder.count());
        assertFalse(bladder.isSet(3, 3, 0));
        assertTrue(bladder.isSet(1, 1, 0));
    }

    @Test
    @DisplayName("Should keep ROIs without contours as empty masks")
    void shouldKeepEmptyRois() throws Exception {
        RawSegmentation raw = strategy.resolve(write(Map.of("Empty", List.of())), context);

        assertEquals(1, raw.getSegments().size());
        assertTrue(raw.getSegments().get(0).getMask().isEmpty());
    }

    @Test
    @DisplayName("Should skip contours outside the series")
    void shouldSkipContoursOutside() throws Exception {
        RawSegmentation raw = strategy.resolve(write(Map.of("Far", List.of(
                DicomFixtures.square(1.5, 1.5, 4.5, 4.5, 10)))), context);

        assertTrue(raw.getSegments().get(0).getMask().isEmpty());
    }

    @Test
    @DisplayName("Should report a reference to a series that is not loaded")
    void shouldReportUnresolvedReference() throws IOException {
        Path file = DicomTestWriter.write(DicomFixtures.structureSet("P1", "9.9.9", Map.of()),
                tempDir.resolve("other.dcm"));
        SegmentationSource source = SegmentationSource.dicom(file, DicomFileReader.readHeader(file));

        SegmentationException e = assertThrows(SegmentationException.class, () -> strategy.resolve(source, context));
        assertEquals(FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE, e.getReason());
    }
}
