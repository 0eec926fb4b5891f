/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.dto.ConversionResponseDTO;
import com.ammann.coursecorrect.dto.VenueCorrectionSummaryDTO;
import com.ammann.coursecorrect.enumeration.Confidence;
import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.model.CorrectionEntry;
import com.ammann.coursecorrect.model.CorrectionTable;
import com.ammann.coursecorrect.time.FinishTimes;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts finish times between venues using the published correction table.
 *
 * <p>{@code converted = time - offset(from) + offset(to)}. Converting a venue to itself is the
 * identity, and the targets {@code normalized} / {@code baseline} resolve to the baseline venue
 * whose offset is zero. Every call reads one table snapshot, so concurrent recomputation never
 * mixes offsets of two runs.
 */
@ApplicationScoped
public class TimeConversionService
{

    private static final Logger LOG = Logger.getLogger(TimeConversionService.class);

    /** Target aliases resolving to the baseline venue. */
    public static final Set<String> BASELINE_ALIASES = Set.of("normalized", "baseline");

    private final CorrectionTableRegistry registry;

    @Inject MeterRegistry meterRegistry;

    private Counter conversionsCounter;
    private Counter rejectedCounter;

    @Inject
    public TimeConversionService(CorrectionTableRegistry registry)
    {
        this.registry = registry;
    }

    @PostConstruct
    void initMetrics()
    {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - conversion metrics disabled");
            return;
        }
        conversionsCounter = Counter.builder("course_correct_conversions_total")
                .description("Finish time conversions served")
                .tag("outcome", "converted")
                .register(meterRegistry);
        rejectedCounter = Counter.builder("course_correct_conversions_total")
                .description("Finish time conversions served")
                .tag("outcome", "rejected")
                .register(meterRegistry);
    }

    /**
     * Converts a finish time in seconds.
     *
     * @param finishSeconds positive finite finish time
     * @param gender        competition division
     * @param fromVenue     venue the time was recorded at
     * @param toVenue       target venue, or {@code normalized}/{@code baseline}
     * @return converted seconds
     * @throws com.ammann.coursecorrect.exception.InvalidTimeException if the time is not positive and finite
     * @throws com.ammann.coursecorrect.exception.UnknownVenueException if a venue has no entry for the gender
     */
    public double convert(double finishSeconds, Gender gender, String fromVenue, String toVenue)
    {
        CorrectionTable table = registry.require();
        return convert(table, finishSeconds, gender, fromVenue, toVenue).convertedSeconds();
    }

    /**
     * Parses and converts a finish time string, returning the display payload.
     *
     * @param finishTime time as {@code HH:MM:SS} or {@code MM:SS}
     * @param gender     competition division
     * @param fromVenue  venue the time was recorded at
     * @param toVenue    target venue, or {@code normalized}/{@code baseline}
     */
    public ConversionResponseDTO convert(String finishTime, Gender gender, String fromVenue, String toVenue)
    {
        try {
            double seconds = FinishTimes.parseSeconds(finishTime);
            CorrectionTable table = registry.require();
            Conversion conversion = convert(table, seconds, gender, fromVenue, toVenue);
            increment(conversionsCounter);

            LOG.debugf("Converted %s (%s) from %s to %s: %.1fs -> %.1fs",
                    finishTime, gender, fromVenue, conversion.toVenue(), seconds, conversion.convertedSeconds());

            return new ConversionResponseDTO(
                    finishTime.strip(),
                    seconds,
                    FinishTimes.format(conversion.convertedSeconds()),
                    conversion.convertedSeconds(),
                    gender.name(),
                    fromVenue,
                    conversion.toVenue(),
                    conversion.fromOffsetSeconds(),
                    conversion.toOffsetSeconds(),
                    FinishTimes.format(conversion.differenceSeconds()),
                    conversion.differenceSeconds(),
                    conversion.faster(),
                    table.getBaselineVenue());
        } catch (RuntimeException e) {
            increment(rejectedCounter);
            throw e;
        }
    }

    /**
     * Lists every venue of the published table with its per-gender corrections, fastest men's
     * course first. Venues without a men's entry follow, ordered by the women's offset. Ties are
     * broken by venue name, so the order is stable for a given table.
     */
    public List<VenueCorrectionSummaryDTO> listVenues()
    {
        CorrectionTable table = registry.require();
        List<VenueCorrectionSummaryDTO> venues = new ArrayList<>();

        for (String venue : table.getVenues()) {
            Optional<CorrectionEntry> men = table.find(venue, Gender.M);
            Optional<CorrectionEntry> women = table.find(venue, Gender.W);

            int sampleCount = men.map(CorrectionEntry::sampleCount).orElse(0)
                    + women.map(CorrectionEntry::sampleCount).orElse(0);
            boolean lowConfidence = men.map(e -> e.confidence() == Confidence.LOW).orElse(false)
                    || women.map(e -> e.confidence() == Confidence.LOW).orElse(false);

            venues.add(new VenueCorrectionSummaryDTO(
                    venue,
                    men.map(CorrectionEntry::offsetPct).orElse(null),
                    women.map(CorrectionEntry::offsetPct).orElse(null),
                    men.map(e -> CorrectionCalculationService.formatPercentage(e.offsetPct())).orElse(null),
                    women.map(e -> CorrectionCalculationService.formatPercentage(e.offsetPct())).orElse(null),
                    men.map(CorrectionEntry::offsetSeconds).orElse(null),
                    women.map(CorrectionEntry::offsetSeconds).orElse(null),
                    sampleCount,
                    lowConfidence ? Confidence.LOW : Confidence.NORMAL,
                    venue.equals(table.getBaselineVenue())));
        }

        venues.sort(LISTING_ORDER);
        return venues;
    }

    static final Comparator<VenueCorrectionSummaryDTO> LISTING_ORDER =
            Comparator.comparing((VenueCorrectionSummaryDTO v) -> v.menOffsetSeconds() == null)
                    .thenComparing(v -> v.menOffsetSeconds() != null ? v.menOffsetSeconds() : v.womenOffsetSeconds(),
                            Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(VenueCorrectionSummaryDTO::venue);

    private Conversion convert(
            CorrectionTable table, double finishSeconds, Gender gender, String fromVenue, String toVenue)
    {
        FinishTimes.requireValidSeconds(finishSeconds);

        String target = resolveTarget(table, toVenue);
        CorrectionEntry from = table.require(fromVenue, gender);
        CorrectionEntry to = table.require(target, gender);

        double converted = fromVenue.equals(target)
                ? finishSeconds
                : finishSeconds - from.offsetSeconds() + to.offsetSeconds();

        return new Conversion(
                target,
                from.offsetSeconds(),
                to.offsetSeconds(),
                converted,
                Math.abs(converted - finishSeconds),
                converted < finishSeconds);
    }

    private String resolveTarget(CorrectionTable table, String toVenue)
    {
        if (toVenue == null || BASELINE_ALIASES.contains(toVenue.strip().toLowerCase(Locale.ROOT))) {
            return table.getBaselineVenue();
        }
        return toVenue;
    }

    private void increment(Counter counter)
    {
        if (counter != null) {
            counter.increment();
        }
    }

    private record Conversion(
            String toVenue,
            double fromOffsetSeconds,
            double toOffsetSeconds,
            double convertedSeconds,
            double differenceSeconds,
            boolean faster) {}
}
