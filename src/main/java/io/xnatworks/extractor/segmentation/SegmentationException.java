/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.model.FailureReason;

/**
 * A segmentation source that cannot be turned into segments for a loaded series.
 */
public class SegmentationException extends Exception {

    private final FailureReason reason;

    public SegmentationException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SegmentationException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
