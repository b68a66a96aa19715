/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.model;

/**
 * Why a patient, series, segmentation or segment was left out of the extracted records.
 */
public enum FailureReason {
    NO_DICOM_FILES("No DICOM files found"),
    UNREADABLE_FILE("File could not be read"),
    INCONSISTENT_GEOMETRY("Series slices have inconsistent geometry"),
    UNREADABLE_SERIES("Series pixel data could not be read"),
    MISSING_CRITERION("No series matched a configured criterion"),
    DUPLICATE_CRITERION_MATCH("More than one series matched the same criterion"),
    NO_MATCHING_IMAGES("No matching images"),
    UNKNOWN_SEGMENTATION_FORMAT("Segmentation format not recognized"),
    UNREADABLE_SEGMENTATION("Segmentation could not be read"),
    UNRESOLVED_SEGMENTATION_REFERENCE("Segmentation references no loaded series"),
    UNALIASED_SEGMENT("Segment label has no organ alias"),
    TRANSFORM_FAILED("Transform failed"),
    DUPLICATE_PATIENT("Patient ID already extracted from another folder"),
    PATIENT_READ_FAILED("Patient could not be read");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Reasons that leave the patient without any record.
     */
    public boolean dropsPatient() {
        return this == NO_DICOM_FILES || this == NO_MATCHING_IMAGES
                || this == TRANSFORM_FAILED || this == DUPLICATE_PATIENT || this == PATIENT_READ_FAILED;
    }
}
