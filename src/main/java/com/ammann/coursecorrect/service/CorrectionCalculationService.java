/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.enumeration.Confidence;
import com.ammann.coursecorrect.model.BaselineSelection;
import com.ammann.coursecorrect.model.CorrectionEntry;
import com.ammann.coursecorrect.model.VenueStat;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Derives signed per-venue, per-gender corrections relative to the baseline venue.
 *
 * <p>{@code offsetSeconds = venueMedian - baselineMedian}: positive for a slower course.
 * The displayed percentage inverts the sign, {@code offsetPct = -(offset / baselineMedian) * 100},
 * so a fast course shows a positive percentage (time must be added to normalize onto the
 * baseline). Percentages are rounded half-up to one decimal and anything below 0.05 in
 * magnitude is exactly zero.
 */
@ApplicationScoped
public class CorrectionCalculationService
{

    private static final Logger LOG = Logger.getLogger(CorrectionCalculationService.class);

    public static final int DEFAULT_LOW_CONFIDENCE_THRESHOLD = 50;
    private static final double ZERO_PERCENT_THRESHOLD = 0.05;

    @ConfigProperty(name = "course-correct.corrections.low-confidence-threshold", defaultValue = "50")
    int lowConfidenceThreshold = DEFAULT_LOW_CONFIDENCE_THRESHOLD;

    /**
     * Computes one entry per statistic.
     *
     * @param stats     venue statistics, at most one per venue/gender
     * @param baseline  the shared baseline and its medians
     * @return entries in the order of {@code stats}
     */
    public List<CorrectionEntry> calculate(Collection<VenueStat> stats, BaselineSelection baseline)
    {
        List<CorrectionEntry> entries = new ArrayList<>(stats.size());
        int lowConfidence = 0;

        for (VenueStat stat : stats) {
            double baselineMedian = baseline.medianFor(stat.gender());
            boolean isBaseline = stat.venue().equals(baseline.venue());

            double offsetSeconds = isBaseline ? 0.0 : stat.medianSeconds() - baselineMedian;
            double offsetPct = isBaseline ? 0.0 : percentage(offsetSeconds, baselineMedian);
            Confidence confidence = Confidence.fromSampleCount(stat.sampleCount(), lowConfidenceThreshold);
            if (confidence == Confidence.LOW) {
                lowConfidence++;
            }

            entries.add(new CorrectionEntry(
                    stat.venue(),
                    stat.gender(),
                    offsetSeconds,
                    offsetPct,
                    stat.sampleCount(),
                    stat.medianSeconds(),
                    confidence));
        }

        if (lowConfidence > 0) {
            LOG.warnf("%d of %d correction entries have fewer than %d samples (low confidence)",
                    lowConfidence, entries.size(), lowConfidenceThreshold);
        }
        LOG.debugf("Calculated %d correction entries against baseline %s", entries.size(), baseline.venue());
        return entries;
    }

    /**
     * Converts an offset into the sign-inverted display percentage.
     *
     * @param offsetSeconds  venue median minus baseline median
     * @param baselineMedian baseline median of the same gender
     * @return percentage rounded to one decimal, {@code 0.0} below 0.05 in magnitude
     */
    public static double percentage(double offsetSeconds, double baselineMedian)
    {
        if (baselineMedian == 0) {
            return 0.0;
        }
        double raw = -(offsetSeconds / baselineMedian) * 100.0;
        if (Math.abs(raw) < ZERO_PERCENT_THRESHOLD || Double.isNaN(raw)) {
            return 0.0;
        }
        double rounded = BigDecimal.valueOf(raw).setScale(1, RoundingMode.HALF_UP).doubleValue();
        // -0.0 must never leak into the table
        return rounded == 0.0 ? 0.0 : rounded;
    }

    /**
     * Formats a correction percentage for athletes: {@code +15.7%}, {@code -8.8%}, {@code 0.0%}.
     */
    public static String formatPercentage(double offsetPct)
    {
        if (Math.abs(offsetPct) < ZERO_PERCENT_THRESHOLD) {
            return "0.0%";
        }
        String sign = offsetPct > 0 ? "+" : "";
        return sign + String.format(Locale.ROOT, "%.1f%%", offsetPct);
    }
}
