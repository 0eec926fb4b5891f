/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.InsufficientDataException;
import com.ammann.coursecorrect.model.ResultRecord;
import com.ammann.coursecorrect.model.VenueGender;
import com.ammann.coursecorrect.model.VenueStat;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes per-venue, per-gender summary statistics from quality-filtered records.
 *
 * <p>For every group: sample count, standard median (average of the two middle values for
 * even counts), mean, and a percentile ladder at {@link #PERCENTILE_CUT_POINTS} using linear
 * interpolation between closest ranks. Deterministic.
 */
@ApplicationScoped
public class VenueAggregationService
{

    private static final Logger LOG = Logger.getLogger(VenueAggregationService.class);

    /** Fixed percentile cut points of every ladder. */
    public static final List<Integer> PERCENTILE_CUT_POINTS = List.of(10, 25, 50, 75, 90);

    /**
     * Aggregates every non-empty group. Groups without records produce no statistic.
     *
     * @param groups filtered records keyed by venue/gender
     * @return statistics ordered by venue, then gender
     */
    public List<VenueStat> aggregate(Map<VenueGender, List<ResultRecord>> groups)
    {
        List<VenueStat> stats = new ArrayList<>();
        groups.entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .sorted(Map.Entry.comparingByKey(VenueGender.NATURAL_ORDER))
                .forEach(entry -> stats.add(
                        aggregateGroup(entry.getKey().venue(), entry.getKey().gender(), entry.getValue())));

        LOG.debugf("Aggregated %d venue/gender groups", stats.size());
        return stats;
    }

    /**
     * Aggregates one group that the caller expects to exist.
     *
     * @param venue   venue name
     * @param gender  competition division
     * @param records filtered records of the group
     * @return the group statistic
     * @throws InsufficientDataException if the group has no records
     */
    public VenueStat aggregateGroup(String venue, Gender gender, Collection<ResultRecord> records)
    {
        if (records == null || records.isEmpty()) {
            throw new InsufficientDataException(venue, gender);
        }

        double[] sorted = records.stream()
                .mapToDouble(ResultRecord::finishSeconds)
                .sorted()
                .toArray();

        SortedMap<Integer, Double> ladder = new TreeMap<>();
        for (Integer cutPoint : PERCENTILE_CUT_POINTS) {
            ladder.put(cutPoint, percentile(sorted, cutPoint));
        }

        return new VenueStat(
                venue,
                gender,
                sorted.length,
                median(sorted),
                Arrays.stream(sorted).average().orElse(0.0),
                ladder);
    }

    /**
     * Standard median of an ascending array.
     *
     * @throws IllegalArgumentException if the array is empty
     */
    public static double median(double[] sorted)
    {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("median requires at least one value");
        }
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }

    /**
     * Percentile of an ascending array with linear interpolation at rank
     * {@code p / 100 * (n - 1)}.
     *
     * @param sorted     ascending values, non-empty
     * @param percentile percentile in [0, 100]
     */
    public static double percentile(double[] sorted, double percentile)
    {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("percentile requires at least one value");
        }
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be within [0, 100]: " + percentile);
        }

        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }
}
