/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.extract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.xnatworks.extractor.model.FailureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one extraction run, written as JSON next to the store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionReport {
    private static final Logger log = LoggerFactory.getLogger(ExtractionReport.class);

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("finished_at")
    private Instant finishedAt;

    @JsonProperty("database")
    private String database;

    @JsonProperty("patients_found")
    private int patientsFound;

    @JsonProperty("patients_written")
    private int patientsWritten;

    @JsonProperty("patients_failed")
    private List<String> patientsFailed = new ArrayList<>();

    @JsonProperty("failures")
    private List<FailureRecord> failures = new ArrayList<>();

    @JsonProperty("match_criteria")
    private Map<String, List<String>> matchCriteria = new LinkedHashMap<>();

    public ExtractionReport() {
    }

    /**
     * Snapshot of an exhausted extractor.
     */
    public static ExtractionReport of(PatientsDataExtractor extractor, Path database, Instant startedAt,
                                      int patientsWritten) {
        ExtractionReport report = new ExtractionReport();
        report.setStartedAt(startedAt);
        report.setFinishedAt(Instant.now());
        report.setDatabase(database != null ? database.toString() : null);
        report.setPatientsFound(extractor.getPatientCount());
        report.setPatientsWritten(patientsWritten);
        report.setPatientsFailed(extractor.getPatientsWhoFailed());
        report.setFailures(extractor.getFailures());
        report.setMatchCriteria(extractor.getMatchCriteria().toMap());
        return report;
    }

    static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public void writeTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper().writeValue(file.toFile(), this);
        log.info("Extraction report written to {}", file);
    }

    public static ExtractionReport read(Path file) throws IOException {
        return mapper().readValue(file.toFile(), ExtractionReport.class);
    }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }

    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }

    public int getPatientsFound() { return patientsFound; }
    public void setPatientsFound(int patientsFound) { this.patientsFound = patientsFound; }

    public int getPatientsWritten() { return patientsWritten; }
    public void setPatientsWritten(int patientsWritten) { this.patientsWritten = patientsWritten; }

    public List<String> getPatientsFailed() { return patientsFailed; }
    public void setPatientsFailed(List<String> patientsFailed) { this.patientsFailed = new ArrayList<>(patientsFailed); }

    public List<FailureRecord> getFailures() { return failures; }
    public void setFailures(List<FailureRecord> failures) { this.failures = new ArrayList<>(failures); }

    public Map<String, List<String>> getMatchCriteria() { return matchCriteria; }
    public void setMatchCriteria(Map<String, List<String>> matchCriteria) {
        this.matchCriteria = new LinkedHashMap<>(matchCriteria);
    }
}
