/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One recovered problem for a patient. Collected across the run and written to the report.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FailureRecord {

    @JsonProperty("patient_id")
    private String patientId;

    @JsonProperty("reason")
    private FailureReason reason;

    @JsonProperty("detail")
    private String detail;

    @JsonProperty("missing_criteria")
    private List<String> missingCriteria = new ArrayList<>();

    @JsonProperty("available_descriptions")
    private List<String> availableDescriptions = new ArrayList<>();

    public FailureRecord() {
    }

    public FailureRecord(String patientId, FailureReason reason, String detail) {
        this.patientId = patientId;
        this.reason = reason;
        this.detail = detail;
    }

    public String getPatientId() { return patientId; }
    public void setPatientId(String patientId) { this.patientId = patientId; }

    public FailureReason getReason() { return reason; }
    public void setReason(FailureReason reason) { this.reason = reason; }

    public String getDetail() { return detail; }
    public void setDetail(String detail) { this.detail = detail; }

    public List<String> getMissingCriteria() { return missingCriteria; }
    public void setMissingCriteria(List<String> missingCriteria) {
        this.missingCriteria = missingCriteria != null ? new ArrayList<>(missingCriteria) : new ArrayList<>();
    }

    public List<String> getAvailableDescriptions() { return availableDescriptions; }
    public void setAvailableDescriptions(List<String> availableDescriptions) {
        this.availableDescriptions = availableDescriptions != null ? new ArrayList<>(availableDescriptions) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return patientId + ": " + reason + (detail != null ? " (" + detail + ")" : "");
    }
}
