/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything extracted for one patient, keyed by criterion name in match order.
 */
public final class PatientRecord {

    private final String patientId;
    private final String patientName;
    private final Map<String, RecordEntry> entries;
    private final List<String> transforms;

    public PatientRecord(String patientId, String patientName, Map<String, RecordEntry> entries) {
        this(patientId, patientName, entries, Collections.emptyList());
    }

    public PatientRecord(String patientId, String patientName, Map<String, RecordEntry> entries,
                         List<String> transforms) {
        this.patientId = patientId;
        this.patientName = patientName;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.transforms = List.copyOf(transforms);
    }

    public String getPatientId() { return patientId; }

    /**
     * Name of the patient folder the record was read from.
     */
    public String getPatientName() { return patientName; }

    public Map<String, RecordEntry> getEntries() { return entries; }

    public RecordEntry getEntry(String criterion) {
        return entries.get(criterion);
    }

    public List<String> getCriterionNames() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Descriptions of the transforms applied to this record, in order.
     */
    public List<String> getTransforms() { return transforms; }

    public PatientRecord withEntries(Map<String, RecordEntry> newEntries, List<String> newTransforms) {
        return new PatientRecord(patientId, patientName, newEntries, newTransforms);
    }

    @Override
    public String toString() {
        return "PatientRecord{" + patientId + ", " + entries.keySet() + "}";
    }
}
