/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.record;

import io.xnatworks.extractor.match.MatchSelection;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.model.ImageSeries;
import io.xnatworks.extractor.model.PatientRecord;
import io.xnatworks.extractor.model.RecordEntry;
import io.xnatworks.extractor.model.Segmentation;
import io.xnatworks.extractor.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Joins a patient's matched series with the segmentations that reference them.
 *
 * <p>A segmentation is attached to the entry whose series UID equals its reference; several
 * segmentations of one series are merged. Segmentations of any other series are dropped.
 * A patient with no readable matched series yields no record.</p>
 */
public class RecordAssembler {
    private static final Logger log = LoggerFactory.getLogger(RecordAssembler.class);

    /**
     * @param images     volumes of the matched series that could be read, by series UID
     * @param failures   receives every recovered problem
     */
    public Optional<PatientRecord> assemble(String patientId, String patientName, MatchSelection selection,
                                            Map<String, Volume> images, List<Segmentation> segmentations,
                                            List<FailureRecord> failures) {
        for (ImageSeries duplicate : selection.getDuplicates()) {
            failures.add(new FailureRecord(patientId, FailureReason.DUPLICATE_CRITERION_MATCH,
                    "Series " + duplicate.getSeriesInstanceUid() + " '" + duplicate.getDescription() + "' dropped"));
        }

        if (!selection.getMissingCriteria().isEmpty()) {
            FailureReason reason = selection.isEmpty() ? FailureReason.NO_MATCHING_IMAGES : FailureReason.MISSING_CRITERION;
            FailureRecord missing = new FailureRecord(patientId, reason,
                    "No series for " + String.join(", ", selection.getMissingCriteria()));
            missing.setMissingCriteria(selection.getMissingCriteria());
            missing.setAvailableDescriptions(selection.getAvailableDescriptions());
            failures.add(missing);
        }

        if (selection.isEmpty()) {
            if (selection.getMissingCriteria().isEmpty()) {
                FailureRecord none = new FailureRecord(patientId, FailureReason.NO_MATCHING_IMAGES, "No image series");
                none.setAvailableDescriptions(selection.getAvailableDescriptions());
                failures.add(none);
            }
            log.warn("Patient {}: no matching images", patientId);
            return Optional.empty();
        }

        Map<String, Segmentation> bySeries = new LinkedHashMap<>();
        for (Segmentation segmentation : segmentations) {
            bySeries.merge(segmentation.getReferencedSeriesUid(), segmentation, Segmentation::merge);
        }

        Map<String, RecordEntry> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ImageSeries> match : selection.getMatched().entrySet()) {
            String seriesUid = match.getValue().getSeriesInstanceUid();
            Volume image = images.get(seriesUid);
            if (image == null) {
                continue;
            }
            Segmentation segmentation = bySeries.remove(seriesUid);
            if (segmentation != null && segmentation.isEmpty()) {
                log.debug("Patient {}: segmentation of {} has no aliased organs", patientId, match.getKey());
                segmentation = null;
            }
            entries.put(match.getKey(), new RecordEntry(match.getKey(), match.getValue(), image, segmentation));
        }

        for (Segmentation orphan : bySeries.values()) {
            log.warn("Patient {}: segmentation {} references series {} which is not in the record",
                    patientId, orphan.getSources(), orphan.getReferencedSeriesUid());
            failures.add(new FailureRecord(patientId, FailureReason.UNRESOLVED_SEGMENTATION_REFERENCE,
                    "Series " + orphan.getReferencedSeriesUid() + " not in record"));
        }

        if (entries.isEmpty()) {
            failures.add(new FailureRecord(patientId, FailureReason.NO_MATCHING_IMAGES,
                    "None of the matched series could be read"));
            log.warn("Patient {}: none of the matched series could be read", patientId);
            return Optional.empty();
        }
        return Optional.of(new PatientRecord(patientId, patientName, entries));
    }
}
