/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.extractor.dicom;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DicomTag.
 */
@DisplayName("DicomTag Tests")
class DicomTagTest {

    @Nested
    @DisplayName("Tag Spec Parsing Tests")
    class ParseTests {

        @Test
        @DisplayName("Should parse keywords regardless of case and separators")
        void shouldParseKeywords() {
            assertEquals(DicomTag.SeriesDescription, DicomTag.parse("SeriesDescription"));
            assertEquals(DicomTag.SeriesDescription, DicomTag.parse("series_description"));
            assertEquals(DicomTag.PatientID, DicomTag.parse("patient-id"));
        }

        @Test
        @DisplayName("Should parse group/element pairs")
        void shouldParseGroupElement() {
            assertEquals(0x0008103E, DicomTag.parse("(0008,103E)"));
            assertEquals(0x0008103E, DicomTag.parse("0008,103e"));
        }

        @Test
        @DisplayName("Should parse eight hex digits")
        void shouldParseHex() {
            assertEquals(0x00100020, DicomTag.parse("00100020"));
            assertEquals(0x7FE00010, DicomTag.parse("7FE00010"));
        }

        @Test
        @DisplayName("Should return -1 for unknown specs")
        void shouldRejectUnknown() {
            assertEquals(-1, DicomTag.parse("NoSuchKeyword"));
            assertEquals(-1, DicomTag.parse(""));
            assertEquals(-1, DicomTag.parse(null));
            assertEquals(-1, DicomTag.parse("zz,yy"));
        }
    }

    @Test
    @DisplayName("Should name known tags by keyword and others by group/element")
    void shouldNameTags() {
        assertEquals("Modality", DicomTag.nameOf(DicomTag.Modality));
        assertEquals("(0009,1001)", DicomTag.nameOf(0x00091001));
        assertEquals("(7FE0,0010)", DicomTag.toHexString(DicomTag.PixelData));
    }
}
