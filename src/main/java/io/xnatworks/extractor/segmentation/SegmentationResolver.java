/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.segmentation;

import io.xnatworks.extractor.locate.SegmentationFilenameMatcher;
import io.xnatworks.extractor.model.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Detects the encoding of a segmentation source and hands it to the matching strategy.
 *
 * <p>Strategies are tried in {@link SegmentationFormat} order; the first that accepts the
 * source decides its format.</p>
 */
public class SegmentationResolver {
    private static final Logger log = LoggerFactory.getLogger(SegmentationResolver.class);

    private final Map<SegmentationFormat, SegmentationStrategy> strategies = new EnumMap<>(SegmentationFormat.class);

    /**
     * Resolver with the DICOM SEG, RTSTRUCT and NRRD strategies.
     */
    public static SegmentationResolver createDefault(SegmentationFilenameMatcher filenameMatcher) {
        SegmentationResolver resolver = new SegmentationResolver();
        resolver.register(new StructuredLabelStrategy());
        resolver.register(new RegionContourStrategy());
        resolver.register(new FilenameConventionStrategy(filenameMatcher));
        return resolver;
    }

    public void register(SegmentationStrategy strategy) {
        SegmentationStrategy previous = strategies.put(strategy.format(), strategy);
        if (previous != null) {
            log.debug("Replaced {} strategy {} with {}", strategy.format(),
                    previous.getClass().getSimpleName(), strategy.getClass().getSimpleName());
        }
    }

    public Optional<SegmentationFormat> detect(SegmentationSource source) {
        for (SegmentationStrategy strategy : strategies.values()) {
            if (strategy.accepts(source)) {
                return Optional.of(strategy.format());
            }
        }
        return Optional.empty();
    }

    public RawSegmentation resolve(SegmentationSource source, ResolutionContext context) throws SegmentationException {
        Optional<SegmentationFormat> format = detect(source);
        if (format.isEmpty()) {
            throw new SegmentationException(FailureReason.UNKNOWN_SEGMENTATION_FORMAT,
                    "Unrecognized segmentation file " + source.getFileName());
        }
        log.debug("Resolving {} as {}", source.getFileName(), format.get().getDisplayName());
        RawSegmentation result = strategies.get(format.get()).resolve(source, context);
        log.debug("{} references series {} with {} segments", source.getFileName(),
                result.getReferencedSeriesUid(), result.getSegments().size());
        return result;
    }
}
