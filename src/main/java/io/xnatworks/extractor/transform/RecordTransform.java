/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.transform;

/**
 * An operation applied to every extracted record before it is stored.
 *
 * <p>Implementations signal a record they cannot handle by throwing an unchecked exception;
 * the patient is then dropped and the run moves on.</p>
 */
public interface RecordTransform {

    /**
     * Short description recorded in the store's transform history.
     */
    String describe();

    RecordData apply(RecordData data);
}
