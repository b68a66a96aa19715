/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.nrrd;

import io.xnatworks.extractor.model.ImageGeometry;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NrrdReader and NrrdFile.
 */
@DisplayName("NrrdReader Tests")
class NrrdReaderTest {

    @TempDir
    Path tempDir;

    private static final ImageGeometry GRID = new ImageGeometry(new int[]{3, 2, 2}, new double[]{0.5, 0.5, 2},
            new double[]{-10, 20, 5}, new double[]{1, 0, 0, 0, 1, 0, 0, 0, 1});

    private static int[] ramp(int count) {
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            values[i] = i % 4;
        }
        return values;
    }

    @Nested
    @DisplayName("Sample Data Tests")
    class DataTests {

        @Test
        @DisplayName("Should read raw samples in file order")
        void shouldReadRaw() throws IOException {
            Path file = NrrdTestWriter.write(tempDir.resolve("labels.nrrd"), GRID, ramp(12));

            NrrdFile nrrd = NrrdReader.read(file);

            assertEquals(3, nrrd.getDimension());
            assertArrayEquals(new int[]{3, 2, 2}, nrrd.getSizes());
            assertArrayEquals(ramp(12), nrrd.getData());
            assertEquals(1, nrrd.getLayerCount());
            assertEquals("unsigned short", nrrd.getFields().get("type"));
        }

        @Test
        @DisplayName("Should read gzip encoded samples")
        void shouldReadGzip() throws IOException {
            Path file = NrrdTestWriter.write(tempDir.resolve("labels.seg.nrrd"), GRID, ramp(12), Map.of(), true);

            assertArrayEquals(ramp(12), NrrdReader.read(file).getData());
        }

        @Test
        @DisplayName("Should read ascii samples and round floating point values")
        void shouldReadAscii() throws IOException {
            String text = "NRRD0004\ntype: float\ndimension: 3\nsizes: 2 1 1\nencoding: ascii\n\n0.2 1.7\n";
            Path file = Files.writeString(tempDir.resolve("a.nrrd"), text);

            assertArrayEquals(new int[]{0, 2}, NrrdReader.read(file).getData());
        }

        @Test
        @DisplayName("Should split a leading list axis into layers")
        void shouldSplitLayers() throws IOException {
            String header = "NRRD0004\ntype: uchar\ndimension: 4\nsizes: 2 2 1 1\nencoding: raw\n\n";
            byte[] bytes = (header + "\u0001\u0000\u0000\u0002").getBytes(StandardCharsets.ISO_8859_1);
            Path file = Files.write(tempDir.resolve("layers.nrrd"), bytes);

            NrrdFile nrrd = NrrdReader.read(file);

            assertEquals(2, nrrd.getLayerCount());
            assertArrayEquals(new int[]{1, 0}, nrrd.getLayer(0));
            assertArrayEquals(new int[]{0, 2}, nrrd.getLayer(1));
            assertThrows(IndexOutOfBoundsException.class, () -> nrrd.getLayer(2));
        }
    }

    @Nested
    @DisplayName("Geometry Tests")
    class GeometryTests {

        @Test
        @DisplayName("Should read LPS geometry unchanged")
        void shouldReadLpsGeometry() throws IOException {
            Path file = NrrdTestWriter.write(tempDir.resolve("labels.nrrd"), GRID, ramp(12));

            ImageGeometry geometry = NrrdReader.read(file).getGeometry();

            assertTrue(GRID.isCongruent(geometry), "read " + geometry);
        }

        @Test
        @DisplayName("Should flip RAS geometry into LPS")
        void shouldFlipRas() throws IOException {
            String header = "NRRD0004\ntype: uchar\ndimension: 3\nspace: right-anterior-superior\nsizes: 1 1 1\n"
                    + "space directions: (2,0,0) (0,3,0) (0,0,4)\nendian: little\nencoding: raw\n"
                    + "space origin: (10,20,30)\n\n";
            byte[] bytes = (header + "\u0001").getBytes(StandardCharsets.ISO_8859_1);
            Path file = Files.write(tempDir.resolve("ras.nrrd"), bytes);

            ImageGeometry geometry = NrrdReader.read(file).getGeometry();

            assertArrayEquals(new double[]{2, 3, 4}, geometry.getSpacing(), 1e-9);
            assertArrayEquals(new double[]{-10, -20, 30}, geometry.getOrigin(), 1e-9);
            assertArrayEquals(new double[]{-1, 0, 0, 0, -1, 0, 0, 0, 1}, geometry.getDirection(), 1e-9);
        }

        @Test
        @DisplayName("Should default to unit spacing without space fields")
        void shouldDefaultGeometry() throws IOException {
            String header = "NRRD0004\ntype: uchar\ndimension: 3\nsizes: 2 1 1\nencoding: raw\n\n";
            Path file = Files.write(tempDir.resolve("plain.nrrd"),
                    (header + "\u0000\u0001").getBytes(StandardCharsets.ISO_8859_1));

            assertEquals(ImageGeometry.identity(2, 1, 1), NrrdReader.read(file).getGeometry());
        }
    }

    @Test
    @DisplayName("Should list Slicer segment metadata in index order")
    void shouldListSegments() throws IOException {
        Map<String, String> keyValues = new LinkedHashMap<>();
        keyValues.put("Segment0_Name", "Prostate");
        keyValues.put("Segment0_LabelValue", "1");
        keyValues.put("Segment0_Layer", "0");
        keyValues.put("Segment1_Name", "Bladder");
        keyValues.put("Segment1_LabelValue", "3");
        Path file = NrrdTestWriter.write(tempDir.resolve("seg.nrrd"), GRID, ramp(12), keyValues, false);

        NrrdFile nrrd = NrrdReader.read(file);
        List<NrrdFile.SegmentInfo> segments = nrrd.getSegments();

        assertTrue(nrrd.hasSegmentMetadata());
        assertEquals(2, segments.size());
        assertEquals("Prostate", segments.get(0).getName());
        assertEquals("Bladder", segments.get(1).getName());
        assertEquals(3, segments.get(1).getLabelValue());
        assertEquals(0, segments.get(1).getLayer());
    }

    @Nested
    @DisplayName("Error Tests")
    class ErrorTests {

        @Test
        @DisplayName("Should reject files without the NRRD magic")
        void shouldRejectMissingMagic() throws IOException {
            Path file = Files.writeString(tempDir.resolve("x.nrrd"), "HELLO WORLD\n\n");

            assertThrows(NrrdFormatException.class, () -> NrrdReader.read(file));
        }

        @Test
        @DisplayName("Should reject headers missing a required field")
        void shouldRejectMissingField() throws IOException {
            Path file = Files.writeString(tempDir.resolve("x.nrrd"), "NRRD0004\ntype: uchar\ndimension: 3\nencoding: raw\n\n");

            NrrdFormatException e = assertThrows(NrrdFormatException.class, () -> NrrdReader.read(file));
            assertTrue(e.getMessage().contains("sizes"));
        }

        @Test
        @DisplayName("Should reject truncated data")
        void shouldRejectTruncated() throws IOException {
            Path file = Files.writeString(tempDir.resolve("x.nrrd"),
                    "NRRD0004\ntype: short\ndimension: 3\nsizes: 2 2 2\nencoding: raw\n\nabc");

            assertThrows(NrrdFormatException.class, () -> NrrdReader.read(file));
        }

        @Test
        @DisplayName("Should reject detached data files")
        void shouldRejectDetached() throws IOException {
            Path file = Files.writeString(tempDir.resolve("x.nhdr"),
                    "NRRD0004\ntype: short\ndimension: 3\nsizes: 2 2 2\nencoding: raw\ndata file: x.raw\n\n");

            assertThrows(NrrdFormatException.class, () -> NrrdReader.read(file));
        }

        @Test
        @DisplayName("Should reject mismatched dimension and sizes")
        void shouldRejectDimensionMismatch() throws IOException {
            Path file = Files.writeString(tempDir.resolve("x.nrrd"),
                    "NRRD0004\ntype: uchar\ndimension: 3\nsizes: 2 2\nencoding: raw\n\n1234");

            assertThrows(NrrdFormatException.class, () -> NrrdReader.read(file));
        }
    }
}
