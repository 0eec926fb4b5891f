/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.ValidationException;
import com.ammann.coursecorrect.model.ResultRecord;
import com.ammann.coursecorrect.model.VenueGender;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Removes implausible and non-competitive finish times before any statistic is computed.
 *
 * <p>Two rules are applied, in order:
 * <ol>
 *   <li>Bounds: times below the lower bound (timing errors) or above the upper bound
 *       (non-competitive finishers) are dropped. Both bounds are inclusive.</li>
 *   <li>Top fraction: a gender sample smaller than the full-sample threshold keeps only its
 *       fastest fraction, at least one record.</li>
 * </ol>
 * No record is ever excluded on any other basis. The service is stateless apart from its
 * configuration.
 */
@ApplicationScoped
public class QualityFilterService
{

    private static final Logger LOG = Logger.getLogger(QualityFilterService.class);

    public static final double DEFAULT_LOWER_BOUND_SECONDS = 3000.0;
    public static final double DEFAULT_UPPER_BOUND_SECONDS = 9000.0;
    public static final double DEFAULT_TOP_FRACTION = 0.8;

    @ConfigProperty(name = "course-correct.quality.lower-bound-seconds", defaultValue = "3000")
    double lowerBoundSeconds = DEFAULT_LOWER_BOUND_SECONDS;

    @ConfigProperty(name = "course-correct.quality.upper-bound-seconds", defaultValue = "9000")
    double upperBoundSeconds = DEFAULT_UPPER_BOUND_SECONDS;

    @ConfigProperty(name = "course-correct.quality.full-sample-threshold", defaultValue = "2147483647")
    int fullSampleThreshold = Integer.MAX_VALUE;

    @ConfigProperty(name = "course-correct.quality.top-fraction", defaultValue = "0.8")
    double topFraction = DEFAULT_TOP_FRACTION;

    @PostConstruct
    void init()
    {
        validateConfiguration();
        LOG.infof("Quality filter initialized: bounds=[%.0f, %.0f]s topFraction=%.2f fullSampleThreshold=%d",
                lowerBoundSeconds, upperBoundSeconds, topFraction, fullSampleThreshold);
    }

    /**
     * Filters the records of one venue. Mixed genders are trimmed per gender sample.
     *
     * @param records records of a single venue
     * @return retained records, fastest first within each gender, men before women
     */
    public List<ResultRecord> filterVenue(Collection<ResultRecord> records)
    {
        Map<Gender, List<ResultRecord>> byGender = new EnumMap<>(Gender.class);
        for (ResultRecord record : records) {
            byGender.computeIfAbsent(record.gender(), g -> new ArrayList<>()).add(record);
        }

        List<ResultRecord> retained = new ArrayList<>();
        byGender.values().forEach(sample -> retained.addAll(filterSample(sample)));
        return retained;
    }

    /**
     * Filters a whole dataset, applying the rules to every venue/gender sample separately.
     *
     * @param records records of any venues and genders
     * @return retained records grouped by venue/gender, groups ordered by venue then gender;
     *         groups emptied by the bounds rule are present with an empty list
     */
    public Map<VenueGender, List<ResultRecord>> filterAll(Collection<ResultRecord> records)
    {
        Map<VenueGender, List<ResultRecord>> groups = records.stream()
                .collect(Collectors.groupingBy(
                        ResultRecord::key,
                        () -> new TreeMap<>(VenueGender.NATURAL_ORDER),
                        Collectors.toList()));

        Map<VenueGender, List<ResultRecord>> filtered = new TreeMap<>(VenueGender.NATURAL_ORDER);
        groups.forEach((key, sample) -> filtered.put(key, filterSample(sample)));

        long retained = filtered.values().stream().mapToLong(List::size).sum();
        LOG.debugf("Quality filter retained %d of %d records across %d groups",
                retained, records.size(), groups.size());
        return filtered;
    }

    /**
     * Applies both rules to a single venue/gender sample.
     *
     * @param sample records of one venue and gender
     * @return retained records sorted ascending by finish time
     */
    public List<ResultRecord> filterSample(Collection<ResultRecord> sample)
    {
        List<ResultRecord> inBounds = sample.stream()
                .filter(this::withinBounds)
                .sorted(ResultRecord.BY_FINISH_TIME)
                .toList();

        if (inBounds.isEmpty() || inBounds.size() >= fullSampleThreshold) {
            return inBounds;
        }

        // epsilon keeps 0.8 * 15 at 12 despite binary rounding
        int keep = Math.max(1, (int) Math.floor(inBounds.size() * topFraction + 1e-9));
        return inBounds.subList(0, Math.min(keep, inBounds.size()));
    }

    /** Returns {@code true} if the record lies within the inclusive quality bounds. */
    public boolean withinBounds(ResultRecord record)
    {
        double seconds = record.finishSeconds();
        return seconds >= lowerBoundSeconds && seconds <= upperBoundSeconds;
    }

    public double getLowerBoundSeconds()
    {
        return lowerBoundSeconds;
    }

    public double getUpperBoundSeconds()
    {
        return upperBoundSeconds;
    }

    /** Fails fast on bounds or fractions that would make the filter meaningless. */
    void validateConfiguration()
    {
        if (!(lowerBoundSeconds > 0) || !(upperBoundSeconds > lowerBoundSeconds)) {
            throw ValidationException.invalidParameter(
                    "course-correct.quality bounds",
                    "[" + lowerBoundSeconds + ", " + upperBoundSeconds + "]",
                    "0 < lower < upper");
        }
        if (!(topFraction > 0) || topFraction > 1.0) {
            throw ValidationException.invalidParameter(
                    "course-correct.quality.top-fraction", topFraction, "value in (0, 1]");
        }
        if (fullSampleThreshold < 0) {
            throw ValidationException.invalidParameter(
                    "course-correct.quality.full-sample-threshold", fullSampleThreshold, "non-negative integer");
        }
    }
}
