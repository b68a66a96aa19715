/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.match;

import java.util.List;
import java.util.Optional;

/**
 * Asked when a configured criterion has no series for a patient. A returned description is
 * added to the criterion's accepted set and the patient is matched again.
 */
public interface SeriesConfirmationHandler {

    /**
     * @param availableDescriptions descriptions of the patient's series that no criterion accepts yet
     * @return the description to accept for {@code criterion}, or empty to leave it unmatched
     */
    Optional<String> confirm(String patientId, String criterion, List<String> availableDescriptions);
}
