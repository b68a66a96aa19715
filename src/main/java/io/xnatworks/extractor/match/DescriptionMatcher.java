/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.match;

import io.xnatworks.extractor.config.MatchCriteria;
import io.xnatworks.extractor.model.ImageSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which criterion, if any, a series satisfies.
 *
 * <p>Matching is exact membership of the series description in a criterion's accepted set.
 * Case and whitespace are significant: clinically distinct series often differ only in
 * details like these. With no criteria configured every series is accepted under its own
 * description, or {@value #UNKNOWN_DESCRIPTION} when it has none.</p>
 */
public class DescriptionMatcher {
    private static final Logger log = LoggerFactory.getLogger(DescriptionMatcher.class);

    public static final String UNKNOWN_DESCRIPTION = "Unknown";

    private final MatchCriteria criteria;

    public DescriptionMatcher(MatchCriteria criteria) {
        this.criteria = criteria;
    }

    public MatchCriteria getCriteria() {
        return criteria;
    }

    public Optional<String> match(String description) {
        if (criteria.isEmpty()) {
            return Optional.of(description != null ? description : UNKNOWN_DESCRIPTION);
        }
        return criteria.findCriterion(description);
    }

    /**
     * Match every series of a patient. The first series to satisfy a criterion keeps it.
     */
    public MatchSelection select(List<ImageSeries> seriesList) {
        MatchSelection selection = new MatchSelection();
        Map<String, ImageSeries> byCriterion = new LinkedHashMap<>();

        for (ImageSeries series : seriesList) {
            String description = series.getDescription();
            if (description != null && !selection.getAvailableDescriptions().contains(description)) {
                selection.getAvailableDescriptions().add(description);
            }

            Optional<String> criterion = match(description);
            if (criterion.isEmpty()) {
                log.debug("Series {} '{}' matches no criterion", series.getSeriesInstanceUid(), description);
                selection.getUnmatched().add(series);
            } else if (byCriterion.containsKey(criterion.get())) {
                log.warn("Series {} also matches criterion {}, keeping series {}", series.getSeriesInstanceUid(),
                        criterion.get(), byCriterion.get(criterion.get()).getSeriesInstanceUid());
                selection.getDuplicates().add(series);
            } else {
                byCriterion.put(criterion.get(), series);
            }
        }

        if (criteria.isEmpty()) {
            selection.getMatched().putAll(byCriterion);
        } else {
            for (String name : criteria.getNames()) {
                ImageSeries series = byCriterion.get(name);
                if (series != null) {
                    selection.getMatched().put(name, series);
                } else {
                    selection.getMissingCriteria().add(name);
                }
            }
        }
        return selection;
    }
}
