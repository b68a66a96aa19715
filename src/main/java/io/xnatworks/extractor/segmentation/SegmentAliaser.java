/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.config.OrganAliases;
import io.xnatworks.extractor.model.Mask;
import io.xnatworks.extractor.model.Segment;
import io.xnatworks.extractor.model.Segmentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Renames raw segment labels to canonical organ names.
 */
public class SegmentAliaser {
    private static final Logger log = LoggerFactory.getLogger(SegmentAliaser.class);

    private final OrganAliases aliases;

    public SegmentAliaser(OrganAliases aliases) {
        this.aliases = aliases;
    }

    public Optional<String> canonicalName(String rawLabel) {
        return aliases.canonicalName(rawLabel);
    }

    /**
     * Segments without an alias are dropped and reported to {@code unmapped}; segments
     * sharing an organ are OR-ed together.
     */
    public Segmentation alias(RawSegmentation raw, Consumer<String> unmapped) {
        Map<String, Mask> organs = new LinkedHashMap<>();
        for (Segment segment : raw.getSegments()) {
            Optional<String> organ = canonicalName(segment.getLabel());
            if (organ.isEmpty()) {
                log.warn("Segment '{}' of {} has no organ alias, dropped", segment.getLabel(),
                        raw.getSource().getFileName());
                unmapped.accept(segment.getLabel());
                continue;
            }
            organs.merge(organ.get(), segment.getMask(), Mask::or);
        }
        return new Segmentation(raw.getReferencedSeriesUid(), organs, List.of(raw.getSource()));
    }
}
