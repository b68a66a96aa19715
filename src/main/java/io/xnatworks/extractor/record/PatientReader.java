/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.record;

import io.xnatworks.extractor.config.MatchCriteria;
import io.xnatworks.extractor.dicom.DicomFileReader;
import io.xnatworks.extractor.locate.PatientLocation;
import io.xnatworks.extractor.match.DescriptionMatcher;
import io.xnatworks.extractor.match.MatchSelection;
import io.xnatworks.extractor.match.SeriesConfirmationHandler;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.model.ImageSeries;
import io.xnatworks.extractor.model.PatientRecord;
import io.xnatworks.extractor.model.Segmentation;
import io.xnatworks.extractor.model.Volume;
import io.xnatworks.extractor.nrrd.NrrdReader;
import io.xnatworks.extractor.segmentation.RawSegmentation;
import io.xnatworks.extractor.segmentation.ResolutionContext;
import io.xnatworks.extractor.segmentation.SegmentAliaser;
import io.xnatworks.extractor.segmentation.SegmentationException;
import io.xnatworks.extractor.segmentation.SegmentationResolver;
import io.xnatworks.extractor.segmentation.SegmentationSource;
import io.xnatworks.extractor.series.GroupingResult;
import io.xnatworks.extractor.series.SeriesGrouper;
import io.xnatworks.extractor.series.VolumeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs the per-patient pipeline: group, match, load, resolve segmentations, assemble.
 *
 * <p>Nothing here throws for a problem confined to the patient; every such problem ends up
 * in the returned failures.</p>
 */
public class PatientReader {
    private static final Logger log = LoggerFactory.getLogger(PatientReader.class);

    private final SeriesGrouper grouper;
    private final DescriptionMatcher matcher;
    private final VolumeReader volumeReader;
    private final SegmentationResolver resolver;
    private final SegmentAliaser aliaser;
    private final RecordAssembler assembler;
    private final SeriesConfirmationHandler confirmationHandler;

    /**
     * @param confirmationHandler asked about criteria left without a series, or null to never ask
     */
    public PatientReader(SeriesGrouper grouper, DescriptionMatcher matcher, VolumeReader volumeReader,
                         SegmentationResolver resolver, SegmentAliaser aliaser, RecordAssembler assembler,
                         SeriesConfirmationHandler confirmationHandler) {
        this.grouper = grouper;
        this.matcher = matcher;
        this.volumeReader = volumeReader;
        this.resolver = resolver;
        this.aliaser = aliaser;
        this.assembler = assembler;
        this.confirmationHandler = confirmationHandler;
    }

    public PatientReadResult read(PatientLocation location) {
        String patientName = location.getPatientName();
        List<FailureRecord> failures = new ArrayList<>();

        if (location.getDicomFiles().isEmpty()) {
            log.warn("Patient {}: no DICOM files in {}", patientName, location.getDirectory());
            failures.add(new FailureRecord(patientName, FailureReason.NO_DICOM_FILES,
                    "No DICOM files in " + location.getDirectory()));
            return new PatientReadResult(patientName, null, failures);
        }

        GroupingResult grouping = grouper.group(location.getDicomFiles());
        String patientId = grouping.getPatientIds().size() == 1
                ? grouping.getPatientIds().iterator().next()
                : patientName;
        for (FailureRecord failure : grouping.getFailures()) {
            failure.setPatientId(patientId);
            failures.add(failure);
        }

        if (grouping.getReadableFiles() == 0) {
            failures.add(new FailureRecord(patientId, FailureReason.NO_DICOM_FILES,
                    "No readable DICOM files in " + location.getDirectory()));
            return new PatientReadResult(patientId, null, failures);
        }
        if (grouping.getPatientIds().size() > 1) {
            log.warn("Patient folder {} holds several patients: {}", patientName, grouping.getPatientIds());
            failures.add(new FailureRecord(patientId, FailureReason.PATIENT_READ_FAILED,
                    "Folder holds several Patient IDs: " + String.join(", ", grouping.getPatientIds())));
            return new PatientReadResult(patientId, null, failures);
        }

        MatchSelection selection = select(patientId, grouping.getSeries());

        Map<String, Volume> images = new LinkedHashMap<>();
        List<ImageSeries> loaded = new ArrayList<>();
        for (ImageSeries series : selection.getMatched().values()) {
            try {
                images.put(series.getSeriesInstanceUid(), volumeReader.read(series));
                loaded.add(series);
            } catch (IOException e) {
                log.warn("Patient {}: cannot read series {}: {}", patientId, series.getSeriesInstanceUid(), e.getMessage());
                failures.add(new FailureRecord(patientId, FailureReason.UNREADABLE_SERIES,
                        "Series " + series.getSeriesInstanceUid() + ": " + e.getMessage()));
            }
        }

        List<Segmentation> segmentations = new ArrayList<>();
        if (!loaded.isEmpty()) {
            ResolutionContext context = new ResolutionContext(patientId, loaded);
            for (SegmentationSource source : segmentationSources(grouping, location, patientId, failures)) {
                resolveSegmentation(source, context, segmentations, failures);
            }
        }

        Optional<PatientRecord> record = assembler.assemble(patientId, patientName, selection, images,
                segmentations, failures);
        record.ifPresent(r -> log.info("Patient {}: {} images added ({}), segmented organs: {}",
                patientId, r.getEntries().size(), String.join(", ", r.getCriterionNames()),
                r.getEntries().values().stream()
                        .flatMap(e -> e.getMasks().keySet().stream())
                        .distinct()
                        .collect(Collectors.joining(", "))));
        return new PatientReadResult(patientId, record.orElse(null), failures);
    }

    /**
     * Match, then ask the confirmation handler about criteria left without a series and
     * match again if it added any description.
     */
    private MatchSelection select(String patientId, List<ImageSeries> series) {
        MatchSelection selection = matcher.select(series);
        MatchCriteria criteria = matcher.getCriteria();
        if (confirmationHandler == null || criteria.isEmpty() || selection.getMissingCriteria().isEmpty()) {
            return selection;
        }

        boolean changed = false;
        for (String criterion : selection.getMissingCriteria()) {
            List<String> candidates = selection.getAvailableDescriptions().stream()
                    .filter(d -> criteria.findCriterion(d).isEmpty())
                    .collect(Collectors.toList());
            if (candidates.isEmpty()) {
                break;
            }
            Optional<String> confirmed = confirmationHandler.confirm(patientId, criterion, candidates);
            if (confirmed.isPresent() && candidates.contains(confirmed.get())) {
                criteria.accept(criterion, confirmed.get());
                changed = true;
            } else if (confirmed.isPresent()) {
                log.warn("Patient {}: '{}' is not an unassigned description, ignored", patientId, confirmed.get());
            }
        }
        return changed ? matcher.select(series) : selection;
    }

    private List<SegmentationSource> segmentationSources(GroupingResult grouping, PatientLocation location,
                                                         String patientId, List<FailureRecord> failures) {
        List<SegmentationSource> sources = new ArrayList<>();
        grouping.getSegmentationObjects().forEach((path, header) -> sources.add(SegmentationSource.dicom(path, header)));

        for (Path file : location.getSegmentationFiles()) {
            if (NrrdReader.isNrrdFile(file) || !DicomFileReader.isDicomFile(file)) {
                sources.add(SegmentationSource.file(file));
                continue;
            }
            try {
                sources.add(SegmentationSource.dicom(file, DicomFileReader.readHeader(file)));
            } catch (IOException e) {
                log.warn("Patient {}: cannot read segmentation {}: {}", patientId, file, e.getMessage());
                failures.add(new FailureRecord(patientId, FailureReason.UNREADABLE_SEGMENTATION,
                        file.getFileName() + ": " + e.getMessage()));
            }
        }
        return sources;
    }

    private void resolveSegmentation(SegmentationSource source, ResolutionContext context,
                                     List<Segmentation> segmentations, List<FailureRecord> failures) {
        String patientId = context.getPatientId();
        try {
            RawSegmentation raw = resolver.resolve(source, context);
            segmentations.add(aliaser.alias(raw, label -> failures.add(new FailureRecord(patientId,
                    FailureReason.UNALIASED_SEGMENT, "Segment '" + label + "' in " + source.getFileName()))));
        } catch (SegmentationException e) {
            log.warn("Patient {}: segmentation {} dropped: {}", patientId, source.getFileName(), e.getMessage());
            failures.add(new FailureRecord(patientId, e.getReason(), e.getMessage()));
        }
    }
}
