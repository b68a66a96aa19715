/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.locate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File name conventions that tie a segmentation file to a patient and to a series.
 *
 * <p>A file belongs to a patient when its name contains the configured prefix immediately
 * followed by the patient number, e.g. {@code Ano12} for prefix {@code Ano} and folder
 * {@code Patient-12}. The patient number is the last run of digits in the folder name, without
 * leading zeros.</p>
 *
 * <p>The referenced series is the loaded series whose full Series Instance UID occurs in the
 * file name. Plain substring search is used: when one UID is a prefix of another, both match
 * and the first in series order wins.</p>
 */
public class SegmentationFilenameMatcher {
    private static final Logger log = LoggerFactory.getLogger(SegmentationFilenameMatcher.class);

    private static final Pattern DIGITS = Pattern.compile("(\\d+)(?!.*\\d)");

    private final String prefix;

    public SegmentationFilenameMatcher(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Patient number prefix must not be empty");
        }
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Last run of digits in a patient folder name as a number, so {@code Patient007} gives {@code 7}.
     */
    public Optional<String> patientNumber(String patientName) {
        Matcher matcher = DIGITS.matcher(patientName);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String digits = matcher.group(1).replaceFirst("^0+(?=\\d)", "");
        return Optional.of(digits);
    }

    /**
     * True when the file name carries {@code prefix + patientNumber} not followed by another digit.
     */
    public boolean belongsToPatient(String fileName, String patientNumber) {
        Pattern token = Pattern.compile(Pattern.quote(prefix + patientNumber) + "(?!\\d)");
        return token.matcher(fileName).find();
    }

    /**
     * Series UIDs, in the given order, that occur as substrings of the file name.
     */
    public List<String> referencedSeries(String fileName, Collection<String> seriesUids) {
        List<String> matches = new ArrayList<>();
        for (String uid : seriesUids) {
            if (uid != null && !uid.isEmpty() && fileName.contains(uid)) {
                matches.add(uid);
            }
        }
        if (matches.size() > 1) {
            log.warn("File name {} contains {} series UIDs, using {}", fileName, matches.size(), matches.get(0));
        }
        return matches;
    }
}
