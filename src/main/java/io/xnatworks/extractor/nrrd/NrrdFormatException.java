/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.nrrd;

import java.io.IOException;

/**
 * Thrown for NRRD files the reader cannot interpret.
 */
public class NrrdFormatException extends IOException {

    public NrrdFormatException(String message) {
        super(message);
    }

    public NrrdFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
