/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.record;

import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.model.PatientRecord;

import java.util.List;
import java.util.Optional;

/**
 * Record (if any) and recovered problems of one patient folder.
 */
public final class PatientReadResult {

    private final String patientId;
    private final PatientRecord record;
    private final List<FailureRecord> failures;

    public PatientReadResult(String patientId, PatientRecord record, List<FailureRecord> failures) {
        this.patientId = patientId;
        this.record = record;
        this.failures = List.copyOf(failures);
    }

    public String getPatientId() { return patientId; }

    public Optional<PatientRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    public List<FailureRecord> getFailures() { return failures; }
}
