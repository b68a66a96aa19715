/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xnatworks.extractor.dicom.DicomTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extraction run configuration, loaded from YAML.
 *
 * <pre>
 * patients_directory: ./patients
 * segmentations_directory: ./segmentations
 * database: ./patients.db
 * match_criteria:
 *   CT: ["CT 3mm", "CT abdomen"]
 *   PT: ["PET AC"]
 * attributes: [Modality, SeriesDescription, PatientID]
 * </pre>
 *
 * Relative paths are resolved against the directory of the configuration file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractorConfig {
    private static final Logger log = LoggerFactory.getLogger(ExtractorConfig.class);

    /**
     * Root directory with one sub-directory per patient.
     */
    @JsonProperty("patients_directory")
    private String patientsDirectory;

    /**
     * Optional shared directory of segmentation files matched to patients by file name.
     */
    @JsonProperty("segmentations_directory")
    private String segmentationsDirectory;

    /**
     * Token that precedes the patient number in segmentation file names.
     */
    @JsonProperty("patient_number_prefix")
    private String patientNumberPrefix = "Ano";

    @JsonProperty("database")
    private String database = "patients.db";

    @JsonProperty("overwrite")
    private boolean overwrite = false;

    /**
     * DICOM keyword whose value is used as the series description.
     */
    @JsonProperty("match_tag")
    private String matchTag = "SeriesDescription";

    @JsonProperty("match_criteria")
    private Map<String, List<String>> matchCriteria;

    @JsonProperty("match_criteria_file")
    private String matchCriteriaFile;

    /**
     * Write the (possibly extended) criteria back to {@code match_criteria_file} after the run.
     */
    @JsonProperty("save_match_criteria")
    private boolean saveMatchCriteria = false;

    @JsonProperty("organ_aliases")
    private Map<String, List<String>> organAliases;

    @JsonProperty("organ_aliases_file")
    private String organAliasesFile;

    /**
     * DICOM keywords copied onto every image dataset in the store.
     */
    @JsonProperty("attributes")
    private List<String> attributes = new ArrayList<>();

    /**
     * When set, only these organs are written.
     */
    @JsonProperty("organs_to_keep")
    private List<String> organsToKeep;

    @JsonProperty("geometry_attributes")
    private boolean geometryAttributes = true;

    @JsonProperty("transpose")
    private boolean transpose = true;

    @JsonProperty("report_file")
    private String reportFile;

    private transient File configFile;

    public static ExtractorConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ExtractorConfig config = mapper.readValue(configFile, ExtractorConfig.class);
        config.configFile = configFile;
        return config;
    }

    public void save(File file) throws IOException {
        log.info("Saving configuration to: {}", file.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, this);
    }

    /**
     * Check settings that would otherwise fail halfway through a run.
     *
     * @throws ConfigurationException on the first problem found
     */
    public void validate() {
        if (patientsDirectory == null || patientsDirectory.isBlank()) {
            throw new ConfigurationException("patients_directory is required");
        }
        if (!Files.isDirectory(getPatientsPath())) {
            throw new ConfigurationException("patients_directory does not exist: " + getPatientsPath());
        }
        if (segmentationsDirectory != null && !Files.isDirectory(getSegmentationsPath())) {
            throw new ConfigurationException("segmentations_directory does not exist: " + getSegmentationsPath());
        }
        if (matchCriteria != null && matchCriteriaFile != null) {
            throw new ConfigurationException("Use either match_criteria or match_criteria_file, not both");
        }
        if (organAliases != null && organAliasesFile != null) {
            throw new ConfigurationException("Use either organ_aliases or organ_aliases_file, not both");
        }
        if (saveMatchCriteria && matchCriteriaFile == null) {
            throw new ConfigurationException("save_match_criteria needs match_criteria_file");
        }
        if (DicomTag.parse(matchTag) < 0) {
            throw new ConfigurationException("Unknown match_tag: " + matchTag);
        }
        for (String attribute : attributes) {
            if (DicomTag.parse(attribute) < 0) {
                throw new ConfigurationException("Unknown attribute: " + attribute);
            }
        }
        if (patientNumberPrefix == null || patientNumberPrefix.isEmpty()) {
            throw new ConfigurationException("patient_number_prefix must not be empty");
        }
    }

    /**
     * The criteria dictionary: from {@code match_criteria_file}, inline {@code match_criteria},
     * or empty (no filtering).
     */
    public MatchCriteria buildMatchCriteria() throws IOException {
        if (matchCriteriaFile != null) {
            Path file = resolve(matchCriteriaFile);
            return Files.exists(file) ? MatchCriteria.load(file) : new MatchCriteria();
        }
        return MatchCriteria.of(matchCriteria);
    }

    public OrganAliases buildOrganAliases() throws IOException {
        if (organAliasesFile != null) {
            return OrganAliases.load(resolve(organAliasesFile));
        }
        if (organAliases != null) {
            return OrganAliases.of(organAliases);
        }
        return OrganAliases.defaults();
    }

    /**
     * Resolve a configured path against the configuration file's directory.
     */
    public Path resolve(String path) {
        Path p = Paths.get(path);
        if (p.isAbsolute() || configFile == null || configFile.getAbsoluteFile().getParentFile() == null) {
            return p;
        }
        return configFile.getAbsoluteFile().getParentFile().toPath().resolve(p).normalize();
    }

    @JsonIgnore
    public Path getPatientsPath() {
        return resolve(patientsDirectory);
    }

    @JsonIgnore
    public Path getSegmentationsPath() {
        return segmentationsDirectory != null ? resolve(segmentationsDirectory) : null;
    }

    @JsonIgnore
    public Path getDatabasePath() {
        return resolve(database);
    }

    @JsonIgnore
    public Path getMatchCriteriaPath() {
        return matchCriteriaFile != null ? resolve(matchCriteriaFile) : null;
    }

    @JsonIgnore
    public Path getReportPath() {
        return reportFile != null ? resolve(reportFile) : null;
    }

    // Getters and setters

    public String getPatientsDirectory() { return patientsDirectory; }
    public void setPatientsDirectory(String patientsDirectory) { this.patientsDirectory = patientsDirectory; }

    public String getSegmentationsDirectory() { return segmentationsDirectory; }
    public void setSegmentationsDirectory(String segmentationsDirectory) { this.segmentationsDirectory = segmentationsDirectory; }

    public String getPatientNumberPrefix() { return patientNumberPrefix; }
    public void setPatientNumberPrefix(String patientNumberPrefix) { this.patientNumberPrefix = patientNumberPrefix; }

    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }

    public boolean isOverwrite() { return overwrite; }
    public void setOverwrite(boolean overwrite) { this.overwrite = overwrite; }

    public String getMatchTag() { return matchTag; }
    public void setMatchTag(String matchTag) { this.matchTag = matchTag; }

    public Map<String, List<String>> getMatchCriteria() { return matchCriteria; }
    public void setMatchCriteria(Map<String, List<String>> matchCriteria) {
        this.matchCriteria = matchCriteria != null ? new LinkedHashMap<>(matchCriteria) : null;
    }

    public String getMatchCriteriaFile() { return matchCriteriaFile; }
    public void setMatchCriteriaFile(String matchCriteriaFile) { this.matchCriteriaFile = matchCriteriaFile; }

    public boolean isSaveMatchCriteria() { return saveMatchCriteria; }
    public void setSaveMatchCriteria(boolean saveMatchCriteria) { this.saveMatchCriteria = saveMatchCriteria; }

    public Map<String, List<String>> getOrganAliases() { return organAliases; }
    public void setOrganAliases(Map<String, List<String>> organAliases) {
        this.organAliases = organAliases != null ? new LinkedHashMap<>(organAliases) : null;
    }

    public String getOrganAliasesFile() { return organAliasesFile; }
    public void setOrganAliasesFile(String organAliasesFile) { this.organAliasesFile = organAliasesFile; }

    public List<String> getAttributes() { return attributes; }
    public void setAttributes(List<String> attributes) {
        this.attributes = attributes != null ? new ArrayList<>(attributes) : new ArrayList<>();
    }

    public List<String> getOrgansToKeep() { return organsToKeep; }
    public void setOrgansToKeep(List<String> organsToKeep) { this.organsToKeep = organsToKeep; }

    public boolean isGeometryAttributes() { return geometryAttributes; }
    public void setGeometryAttributes(boolean geometryAttributes) { this.geometryAttributes = geometryAttributes; }

    public boolean isTranspose() { return transpose; }
    public void setTranspose(boolean transpose) { this.transpose = transpose; }

    public String getReportFile() { return reportFile; }
    public void setReportFile(String reportFile) { this.reportFile = reportFile; }

    @JsonIgnore
    public File getConfigFile() { return configFile; }
    @JsonIgnore
    public void setConfigFile(File configFile) { this.configFile = configFile; }
}
