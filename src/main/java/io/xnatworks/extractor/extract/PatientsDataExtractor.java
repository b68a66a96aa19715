/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.extract;

import io.xnatworks.extractor.config.ConfigurationException;
import io.xnatworks.extractor.config.ExtractorConfig;
import io.xnatworks.extractor.config.MatchCriteria;
import io.xnatworks.extractor.dicom.DicomTag;
import io.xnatworks.extractor.locate.PatientLocation;
import io.xnatworks.extractor.locate.PatientLocator;
import io.xnatworks.extractor.locate.SegmentationFilenameMatcher;
import io.xnatworks.extractor.match.DescriptionMatcher;
import io.xnatworks.extractor.match.SeriesConfirmationHandler;
import io.xnatworks.extractor.model.FailureReason;
import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.PatientRecord;
import io.xnatworks.extractor.model.RecordEntry;
import io.xnatworks.extractor.model.Segmentation;
import io.xnatworks.extractor.model.Volume;
import io.xnatworks.extractor.record.PatientReadResult;
import io.xnatworks.extractor.record.PatientReader;
import io.xnatworks.extractor.record.RecordAssembler;
import io.xnatworks.extractor.segmentation.SegmentAliaser;
import io.xnatworks.extractor.segmentation.SegmentationResolver;
import io.xnatworks.extractor.series.DicomVolumeReader;
import io.xnatworks.extractor.series.SeriesGrouper;
import io.xnatworks.extractor.store.PatientsDatabase;
import io.xnatworks.extractor.transform.RecordData;
import io.xnatworks.extractor.transform.RecordTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lazy sequence of patient records over the folders of a patients directory.
 *
 * <p>A patient is read only when the consumer asks for the next record. Patients that cannot
 * be read or transformed are skipped; their problems are collected in {@link #getFailures()}
 * and their ids in {@link #getPatientsWhoFailed()}. Only configuration problems escape, as
 * {@link ConfigurationException}.</p>
 *
 * <p>Not thread-safe: one consumer per instance.</p>
 */
public class PatientsDataExtractor implements Iterator<PatientRecord> {
    private static final Logger log = LoggerFactory.getLogger(PatientsDataExtractor.class);

    private final PatientLocator locator;
    private final PatientReader reader;
    private final MatchCriteria matchCriteria;
    private final List<RecordTransform> transforms;

    private final List<FailureRecord> failures = new ArrayList<>();
    private final Set<String> patientsWhoFailed = new LinkedHashSet<>();
    private final Map<String, String> extractedFolders = new LinkedHashMap<>();

    private List<Path> patientDirectories;
    private int position;
    private int recordCount;
    private PatientRecord next;

    public PatientsDataExtractor(PatientLocator locator, PatientReader reader, MatchCriteria matchCriteria,
                                 List<RecordTransform> transforms) {
        this.locator = locator;
        this.reader = reader;
        this.matchCriteria = matchCriteria;
        this.transforms = List.copyOf(transforms);
    }

    /**
     * Wire the full pipeline from a configuration.
     *
     * @param confirmationHandler consulted for criteria without a series, or null
     * @throws ConfigurationException when the configuration is invalid
     * @throws IOException when a criteria or alias file cannot be read
     */
    public static PatientsDataExtractor create(ExtractorConfig config, SeriesConfirmationHandler confirmationHandler,
                                               List<RecordTransform> transforms) throws IOException {
        config.validate();
        MatchCriteria criteria = config.buildMatchCriteria();
        SegmentationFilenameMatcher filenameMatcher = new SegmentationFilenameMatcher(config.getPatientNumberPrefix());

        PatientLocator locator = new PatientLocator(config.getPatientsPath(), config.getSegmentationsPath(),
                filenameMatcher);
        PatientReader reader = new PatientReader(
                new SeriesGrouper(DicomTag.parse(config.getMatchTag())),
                new DescriptionMatcher(criteria),
                new DicomVolumeReader(),
                SegmentationResolver.createDefault(filenameMatcher),
                new SegmentAliaser(config.buildOrganAliases()),
                new RecordAssembler(),
                confirmationHandler);
        return new PatientsDataExtractor(locator, reader, criteria, transforms);
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        List<Path> directories = patientDirectories();
        while (next == null && position < directories.size()) {
            Path directory = directories.get(position++);
            log.info("Patient {}/{}: {}", position, directories.size(), directory.getFileName());
            next = readPatient(directory);
        }
        return next != null;
    }

    @Override
    public PatientRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more patients");
        }
        PatientRecord record = next;
        next = null;
        recordCount++;
        return record;
    }

    /**
     * Start again from the first patient folder. Failures collected so far are cleared.
     */
    public void reset() {
        patientDirectories = null;
        position = 0;
        recordCount = 0;
        next = null;
        failures.clear();
        patientsWhoFailed.clear();
        extractedFolders.clear();
    }

    public List<FailureRecord> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    /**
     * Ids of the patients for which no record was produced, in processing order.
     */
    public List<String> getPatientsWhoFailed() {
        return new ArrayList<>(patientsWhoFailed);
    }

    /**
     * The criteria dictionary used for matching, including any description accepted during the run.
     */
    public MatchCriteria getMatchCriteria() {
        return matchCriteria;
    }

    public int getPatientCount() {
        return patientDirectories().size();
    }

    public int getRecordCount() {
        return recordCount;
    }

    private List<Path> patientDirectories() {
        if (patientDirectories == null) {
            try {
                patientDirectories = locator.listPatientDirectories();
            } catch (IOException e) {
                throw new ConfigurationException("Cannot list patient folders: " + e.getMessage(), e);
            }
            log.info("Found {} patient folders", patientDirectories.size());
        }
        return patientDirectories;
    }

    private PatientRecord readPatient(Path directory) {
        String patientName = directory.getFileName().toString();
        PatientReadResult result;
        try {
            PatientLocation location = locator.locate(directory);
            result = reader.read(location);
        } catch (ConfigurationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("Patient {}: read failed: {}", patientName, e.getMessage(), e);
            fail(new FailureRecord(patientName, FailureReason.PATIENT_READ_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
            return null;
        }

        failures.addAll(result.getFailures());
        Optional<PatientRecord> record = result.getRecord();
        if (record.isEmpty()) {
            log.warn("Patient {}: no record produced", result.getPatientId());
            patientsWhoFailed.add(result.getPatientId());
            return null;
        }
        // Keyed by store path: ids that collide after sanitizing are duplicates as well
        String storePath = PatientsDatabase.pathOf(result.getPatientId());
        String firstFolder = extractedFolders.get(storePath);
        if (firstFolder != null) {
            log.warn("Patient {} from folder {} was already extracted from folder {}, skipped",
                    result.getPatientId(), patientName, firstFolder);
            fail(new FailureRecord(result.getPatientId(), FailureReason.DUPLICATE_PATIENT,
                    "Folder " + patientName + " repeats the patient of folder " + firstFolder));
            return null;
        }

        PatientRecord transformed;
        try {
            transformed = transforms.isEmpty() ? record.get() : applyTransforms(record.get());
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Patient {}: transform failed, patient dropped: {}", result.getPatientId(), e.getMessage());
            fail(new FailureRecord(result.getPatientId(), FailureReason.TRANSFORM_FAILED, e.getMessage()));
            return null;
        }
        extractedFolders.put(storePath, patientName);
        return transformed;
    }

    private void fail(FailureRecord failure) {
        failures.add(failure);
        patientsWhoFailed.add(failure.getPatientId());
    }

    /**
     * Apply the transforms in order and rebuild the record from their output. Every mask must
     * still share its image's grid afterwards.
     */
    PatientRecord applyTransforms(PatientRecord record) {
        RecordData data = RecordData.of(record);
        for (RecordTransform transform : transforms) {
            data = transform.apply(data);
            if (data == null) {
                throw new IllegalStateException(transform.describe() + " returned no data");
            }
        }

        Map<String, RecordEntry> entries = new LinkedHashMap<>();
        for (Map.Entry<String, Volume> image : data.getImages().entrySet()) {
            String criterion = image.getKey();
            RecordEntry entry = record.getEntry(criterion);
            if (entry == null) {
                throw new IllegalStateException("Transforms produced image '" + criterion
                        + "' that the record does not have");
            }
            Map<String, Mask> masks = data.getMasks(criterion);
            for (Map.Entry<String, Mask> mask : masks.entrySet()) {
                if (!mask.getValue().getGeometry().isCongruent(image.getValue().getGeometry())) {
                    throw new IllegalStateException("Mask '" + mask.getKey() + "' of image '" + criterion
                            + "' no longer matches the image grid");
                }
            }
            Segmentation segmentation = null;
            if (!masks.isEmpty()) {
                segmentation = new Segmentation(entry.getSeries().getSeriesInstanceUid(), masks,
                        entry.hasSegmentation() ? entry.getSegmentation().getSources() : List.of());
            }
            entries.put(criterion, entry.withData(image.getValue(), segmentation));
        }

        if (entries.isEmpty()) {
            throw new IllegalStateException("Transforms left no image in the record");
        }

        List<String> history = new ArrayList<>(record.getTransforms());
        history.addAll(transforms.stream().map(RecordTransform::describe).collect(Collectors.toList()));
        return record.withEntries(entries, history);
    }
}
