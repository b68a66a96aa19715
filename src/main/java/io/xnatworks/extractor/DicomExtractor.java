/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor;

import io.xnatworks.extractor.config.ConfigurationException;
import io.xnatworks.extractor.config.ExtractorConfig;
import io.xnatworks.extractor.extract.ExtractionReport;
import io.xnatworks.extractor.extract.PatientsDataExtractor;
import io.xnatworks.extractor.match.ConsoleConfirmationHandler;
import io.xnatworks.extractor.model.FailureRecord;
import io.xnatworks.extractor.store.PatientsDatabase;
import io.xnatworks.extractor.store.StoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * XNAT DICOM Extractor - Main Application
 *
 * Builds a per-patient store of images and organ masks from folders of DICOM series
 * and their segmentations (DICOM SEG, RTSTRUCT or NRRD label volumes).
 */
@Command(name = "dicom-extractor",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "XNAT DICOM Extractor - Build a patient image and segmentation store",
        subcommands = {
                DicomExtractor.CreateCommand.class,
                DicomExtractor.InspectCommand.class
        })
public class DicomExtractor implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DicomExtractor.class);

    @Option(names = {"-c", "--config"}, description = "Config file path", defaultValue = "config.yaml")
    protected File configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DicomExtractor()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ========================================================================
    // CREATE COMMAND - Extract patients into a new store
    // ========================================================================

    @Command(name = "create", description = "Extract all patients into a store")
    static class CreateCommand implements Callable<Integer> {

        @ParentCommand
        private DicomExtractor parent;

        @Option(names = {"--overwrite"}, description = "Replace the store if it already exists")
        private boolean overwrite = false;

        @Option(names = {"--interactive"}, description = "Ask which series to use when a criterion finds none")
        private boolean interactive = false;

        @Option(names = {"--database"}, description = "Store path (overrides config file)")
        private File database;

        @Override
        public Integer call() throws Exception {
            ExtractorConfig config;
            try {
                config = ExtractorConfig.load(parent.configFile);
                config.validate();
            } catch (IOException | ConfigurationException e) {
                System.err.println("Cannot use config " + parent.configFile + ": " + e.getMessage());
                return 1;
            }

            Path databasePath = database != null ? database.toPath() : config.getDatabasePath();
            PatientsDatabase store = new PatientsDatabase(databasePath, StoreOptions.fromConfig(config));
            boolean replace = overwrite || config.isOverwrite();

            System.out.println();
            System.out.println("=========================================================");
            System.out.println("  DICOM Extraction");
            System.out.println("=========================================================");
            System.out.println();
            System.out.println("Patients:  " + config.getPatientsPath());
            if (config.getSegmentationsPath() != null) {
                System.out.println("Segments:  " + config.getSegmentationsPath());
            }
            System.out.println("Store:     " + databasePath);
            System.out.println("Overwrite: " + replace);
            System.out.println();

            Instant startedAt = Instant.now();
            PatientsDataExtractor extractor;
            int written;
            try {
                extractor = PatientsDataExtractor.create(config,
                        interactive ? new ConsoleConfirmationHandler() : null,
                        Collections.emptyList());
                written = store.create(extractor, replace);
            } catch (FileAlreadyExistsException e) {
                System.err.println("Store already exists: " + databasePath + " (use --overwrite to replace it)");
                return 2;
            } catch (ConfigurationException e) {
                log.error("Configuration error: {}", e.getMessage());
                System.err.println("Configuration error: " + e.getMessage());
                return 1;
            }

            if (config.isSaveMatchCriteria()) {
                extractor.getMatchCriteria().save(config.getMatchCriteriaPath());
                log.info("Match criteria saved to {}", config.getMatchCriteriaPath());
            }

            ExtractionReport report = ExtractionReport.of(extractor, databasePath, startedAt, written);
            if (config.getReportPath() != null) {
                report.writeTo(config.getReportPath());
            }

            System.out.println();
            System.out.printf("Patients found:   %d%n", report.getPatientsFound());
            System.out.printf("Patients written: %d%n", written);
            System.out.printf("Patients failed:  %d%n", report.getPatientsFailed().size());
            if (!report.getFailures().isEmpty()) {
                System.out.println();
                System.out.println("Problems:");
                System.out.println("─────────────────────────────────────────────────────────");
                for (FailureRecord failure : report.getFailures()) {
                    System.out.printf("%-20s %-34s %s%n", failure.getPatientId(), failure.getReason(),
                            failure.getDetail() != null ? failure.getDetail() : "");
                }
            }
            System.out.println();
            return 0;
        }
    }

    // ========================================================================
    // INSPECT COMMAND - Show the contents of a store
    // ========================================================================

    @Command(name = "inspect", description = "Show the contents of a store")
    static class InspectCommand implements Callable<Integer> {

        @ParentCommand
        private DicomExtractor parent;

        @Parameters(index = "0", arity = "0..1", description = "Store path (default: database from config)")
        private File database;

        @Option(names = {"--attributes"}, description = "Also print dataset attributes")
        private boolean showAttributes = false;

        @Override
        public Integer call() throws Exception {
            Path databasePath;
            if (database != null) {
                databasePath = database.toPath();
            } else {
                databasePath = ExtractorConfig.load(parent.configFile).getDatabasePath();
            }

            PatientsDatabase store = new PatientsDatabase(databasePath);
            if (!store.exists()) {
                System.err.println("Store does not exist: " + databasePath);
                return 1;
            }

            System.out.println();
            System.out.println("Store: " + databasePath.toAbsolutePath());
            System.out.println("─────────────────────────────────────────────────────────");
            for (String patient : store.listPatients()) {
                System.out.println(patient);
                for (String image : store.listImages(patient)) {
                    String imagePath = PatientsDatabase.pathOf(patient, image);
                    System.out.printf("  %-24s %-8s %s%n", image, store.getDtype(imagePath),
                            Arrays.toString(store.getShape(imagePath)));
                    if (showAttributes) {
                        for (Map.Entry<String, String> attribute : store.getAttributes(imagePath).entrySet()) {
                            System.out.printf("      %s = %s%n", attribute.getKey(), attribute.getValue());
                        }
                    }
                    for (String organ : store.listOrgans(patient, image)) {
                        String maskPath = PatientsDatabase.pathOf(patient, image, organ);
                        System.out.printf("    %-22s %-8s %s%n", organ, store.getDtype(maskPath),
                                Arrays.toString(store.getShape(maskPath)));
                    }
                }
            }
            System.out.println();
            return 0;
        }
    }
}
