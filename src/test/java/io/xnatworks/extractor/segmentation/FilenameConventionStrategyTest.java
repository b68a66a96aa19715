/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.dicom.DicomFixtures;
import io.xnatworks.extractor.locate.SegmentationFilenameMatcher;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.ImageGeometry;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.nrrd.NrrdTestWriter;
import io.xnatworks.extractor.series.SeriesGrouper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilenameConventionStrategy.
 */
@DisplayName("FilenameConventionStrategy Tests")
class FilenameConventionStrategyTest {

    private static final String SERIES_UID = "1.2.826.0.1.3680043.8.498.30";
    private static final double[] IDENTITY = {1, 0, 0, 0, 1, 0, 0, 0, 1};

    @TempDir
    Path tempDir;

    private ResolutionContext context;
    private ImageGeometry grid;
    private final FilenameConventionStrategy strategy =
            new FilenameConventionStrategy(new SegmentationFilenameMatcher("Ano"));

    @BeforeEach
    void setUp() throws IOException {
        List<Path> files = DicomFixtures.writeSeries(tempDir.resolve("ct"), "P1", SERIES_UID, "CT", 2, 2, 2);
        context = new ResolutionContext("P1", new SeriesGrouper().group(files).getSeries());
        grid = context.getSeries(SERIES_UID).getGeometry();
    }

    @Test
    @DisplayName("Should split a plain label map into numbered segments")
    void shouldSplitLabelMap() throws Exception {
        Path file = NrrdTestWriter.write(tempDir.resolve("Ano1_" + SERIES_UID + ".nrrd"), grid,
                new int[]{0, 1, 1, 0, 0, 2, 0, 0});
        SegmentationSource source = SegmentationSource.file(file);

        assertTrue(strategy.accepts(source));
        RawSegmentation raw = strategy.resolve(source, context);

        assertEquals(SERIES_UID, raw.getReferencedSeriesUid());
        assertEquals(SegmentationFormat.FILENAME_CONVENTION, raw.getFormat());
        assertEquals(2, raw.getSegments().size());
        assertEquals("Segment_1", raw.getSegments().get(0).getLabel());
        assertArrayEquals(new byte[]{0, 1, 1, 0, 0, 0, 0, 0}, raw.getSegments().get(0).getMask().getData());
        assertEquals("Segment_2", raw.getSegments().get(1).getLabel());
        assertArrayEquals(new byte[]{0, 0, 0, 0, 0, 1, 0, 0}, raw.getSegments().get(1).getMask().getData());
    }

    @Test
    @DisplayName("Should name segments from Slicer metadata")
    void shouldUseSegmentMetadata() throws Exception {
        Map<String, String> keyValues = new LinkedHashMap<>();
        keyValues.put("Segment0_Name", "Prostate");
        keyValues.put("Segment0_LabelValue", "2");
        keyValues.put("Segment0_Layer", "0");
        keyValues.put("Segment1_Name", "Rectum");
        keyValues.put("Segment1_LabelValue", "5");
        keyValues.put("Segment1_Layer", "0");
        Path file = NrrdTestWriter.write(tempDir.resolve("Ano1_" + SERIES_UID + ".seg.nrrd"), grid,
                new int[]{2, 2, 0, 0, 0, 0, 0, 0}, keyValues, true);

        RawSegmentation raw = strategy.resolve(SegmentationSource.file(file), context);

        assertEquals("Prostate", raw.getSegments().get(0).getLabel());
        assertEquals(2, raw.getSegments().get(0).getMask().count());
        assertEquals("Rectum", raw.getSegments().get(1).getLabel());
        assertTrue(raw.getSegments().get(1).getMask().isEmpty());
    }

    @Test
    @DisplayName("Should resample a coarser label map onto the series grid")
    void shouldResample() throws Exception {
        // one voxel of 2 x 2 x 4 mm centred between the series voxels
        ImageGeometry coarse = new ImageGeometry(new int[]{1, 1, 1}, new double[]{2, 2, 4},
                new double[]{0.5, 0.5, 1}, IDENTITY);
        Path file = NrrdTestWriter.write(tempDir.resolve("Ano1_" + SERIES_UID + ".nrrd"), coarse, new int[]{1});

        Mask mask = strategy.resolve(SegmentationSource.file(file), context).getSegments().get(0).getMask();

        assertSame(grid, mask.getGeometry());
        assertEquals(8, mask.count());
    }

    @Test
    @DisplayName("Should report a file name without a loaded series UID")
    void shouldReportUnresolvedReference() throws IOException {
        Path file = NrrdTestWriter.write(tempDir.resolve("Ano1_1.2.3.4.5.nrrd"), grid, new int[8]);

        SegmentationException e = assertThrows(SegmentationException.class,
                () -> strategy.resolve(SegmentationSource.file(file), context));
        assertEquals(FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE, e.getReason());
    }

    @Test
    @DisplayName("Should report an unreadable label volume")
    void shouldReportUnreadableFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Ano1_" + SERIES_UID + ".nrrd"), "NRRD0004\ntype: uchar\n\n");

        SegmentationException e = assertThrows(SegmentationException.class,
                () -> strategy.resolve(SegmentationSource.file(file), context));
        assertEquals(FailureReason.UNREADABLE_SEGMENTATION, e.getReason());
    }
}
