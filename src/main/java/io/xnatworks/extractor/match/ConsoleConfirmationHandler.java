/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Prompts on the console for the series that should satisfy a missing criterion.
 */
public class ConsoleConfirmationHandler implements SeriesConfirmationHandler {
    private static final Logger log = LoggerFactory.getLogger(ConsoleConfirmationHandler.class);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationHandler() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleConfirmationHandler(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Optional<String> confirm(String patientId, String criterion, List<String> availableDescriptions) {
        if (availableDescriptions.isEmpty()) {
            return Optional.empty();
        }

        out.println();
        out.printf("Patient %s: no series matched criterion '%s'.%n", patientId, criterion);
        out.println("Available series descriptions:");
        for (int i = 0; i < availableDescriptions.size(); i++) {
            out.printf("  %d) %s%n", i + 1, availableDescriptions.get(i));
        }
        out.printf("Number of the description to add to '%s' (Enter to skip): ", criterion);
        out.flush();

        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            log.warn("Could not read confirmation for patient {}: {}", patientId, e.getMessage());
            return Optional.empty();
        }
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        int choice;
        try {
            choice = Integer.parseInt(line.trim());
        } catch (NumberFormatException e) {
            choice = -1;
        }
        if (choice < 1 || choice > availableDescriptions.size()) {
            out.println("Invalid choice, skipping.");
            return Optional.empty();
        }
        return Optional.of(availableDescriptions.get(choice - 1));
    }
}
