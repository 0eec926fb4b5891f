/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.NoEligibleBaselineException;
import com.ammann.coursecorrect.model.BaselineSelection;
import com.ammann.coursecorrect.model.VenueStat;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Chooses the single reference venue whose medians become the zero point of both genders.
 *
 * <p>Per gender, eligible venues are ranked by median finish time (ties: larger sample first,
 * then venue name) and the venue at index {@code floor(N / 2)} is picked. Only venues with
 * statistics for both genders are eligible. When the two genders pick different venues, the
 * pick of the gender with the larger total sample count becomes the shared baseline.
 */
@ApplicationScoped
public class BaselineSelectionService
{

    private static final Logger LOG = Logger.getLogger(BaselineSelectionService.class);

    /** Difficulty ranking: median ascending, then larger sample, then venue name. */
    static final Comparator<VenueStat> DIFFICULTY_ORDER =
            Comparator.comparingDouble(VenueStat::medianSeconds)
                    .thenComparing(Comparator.comparingInt(VenueStat::sampleCount).reversed())
                    .thenComparing(VenueStat::venue);

    /**
     * Selects the shared baseline by median ranking.
     *
     * @param stats statistics of all venues and genders
     * @return the selection with per-gender baseline medians
     * @throws NoEligibleBaselineException if a gender has no data or no venue has both genders
     */
    public BaselineSelection select(Collection<VenueStat> stats)
    {
        return select(stats, null);
    }

    /**
     * Selects the shared baseline, optionally forcing an explicit reference venue.
     *
     * @param stats           statistics of all venues and genders
     * @param referenceVenue  venue to use instead of the median ranking, or {@code null}
     * @return the selection with per-gender baseline medians
     * @throws NoEligibleBaselineException if no venue (or not the requested one) is eligible
     */
    public BaselineSelection select(Collection<VenueStat> stats, String referenceVenue)
    {
        Map<Gender, Map<String, VenueStat>> byGender = new EnumMap<>(Gender.class);
        for (Gender gender : Gender.values()) {
            Map<String, VenueStat> forGender = stats.stream()
                    .filter(stat -> stat.gender() == gender)
                    .collect(Collectors.toMap(VenueStat::venue, stat -> stat));
            if (forGender.isEmpty()) {
                throw new NoEligibleBaselineException(
                        "No venue has data for gender " + gender + "; cannot select a baseline");
            }
            byGender.put(gender, forGender);
        }

        Set<String> eligible = new TreeSet<>(byGender.get(Gender.M).keySet());
        eligible.retainAll(byGender.get(Gender.W).keySet());
        if (eligible.isEmpty()) {
            throw new NoEligibleBaselineException("No venue has data for both genders; cannot select a baseline");
        }

        Map<Gender, String> picks = new EnumMap<>(Gender.class);
        String baseline;
        if (referenceVenue != null) {
            if (!eligible.contains(referenceVenue)) {
                throw new NoEligibleBaselineException(String.format(
                        "Reference venue '%s' lacks data for at least one gender", referenceVenue));
            }
            for (Gender gender : Gender.values()) {
                picks.put(gender, referenceVenue);
            }
            baseline = referenceVenue;
            LOG.infof("Using requested reference venue '%s' as baseline", referenceVenue);
        } else {
            for (Gender gender : Gender.values()) {
                picks.put(gender, pickMedianVenue(eligibleStats(byGender.get(gender), eligible)));
            }
            baseline = resolveSharedBaseline(picks, byGender);
        }

        Map<Gender, Double> medians = new EnumMap<>(Gender.class);
        for (Gender gender : Gender.values()) {
            medians.put(gender, byGender.get(gender).get(baseline).medianSeconds());
        }

        LOG.infof("Baseline venue selected: %s (men median=%.1fs, women median=%.1fs, %d eligible venues)",
                baseline, medians.get(Gender.M), medians.get(Gender.W), eligible.size());
        return new BaselineSelection(baseline, medians, picks);
    }

    /**
     * Ranks one gender's statistics by difficulty and returns the venue at {@code floor(N / 2)}.
     *
     * @param stats statistics of a single gender, non-empty
     */
    public String pickMedianVenue(Collection<VenueStat> stats)
    {
        if (stats.isEmpty()) {
            throw new NoEligibleBaselineException("No venues to rank");
        }
        List<VenueStat> ranked = stats.stream().sorted(DIFFICULTY_ORDER).toList();
        return ranked.get(ranked.size() / 2).venue();
    }

    private List<VenueStat> eligibleStats(Map<String, VenueStat> forGender, Set<String> eligible)
    {
        return forGender.values().stream()
                .filter(stat -> eligible.contains(stat.venue()))
                .toList();
    }

    /**
     * Resolves disagreeing per-gender picks: the gender with more records wins; equal totals
     * fall back to the lexicographically first pick.
     */
    private String resolveSharedBaseline(Map<Gender, String> picks, Map<Gender, Map<String, VenueStat>> byGender)
    {
        String men = picks.get(Gender.M);
        String women = picks.get(Gender.W);
        if (men.equals(women)) {
            return men;
        }

        long menTotal = totalSamples(byGender.get(Gender.M));
        long womenTotal = totalSamples(byGender.get(Gender.W));
        String shared;
        if (menTotal != womenTotal) {
            shared = menTotal > womenTotal ? men : women;
        } else {
            shared = men.compareTo(women) <= 0 ? men : women;
        }

        LOG.warnf("Per-gender baselines differ (men=%s, women=%s); using %s as shared baseline "
                        + "(men samples=%d, women samples=%d)",
                men, women, shared, menTotal, womenTotal);
        return shared;
    }

    private long totalSamples(Map<String, VenueStat> forGender)
    {
        return forGender.values().stream().mapToLong(VenueStat::sampleCount).sum();
    }
}
