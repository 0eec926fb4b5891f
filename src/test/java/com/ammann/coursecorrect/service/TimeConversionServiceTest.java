/* (C)2026 */
package com.ammann.coursecorrect.service;

import static com.ammann.coursecorrect.support.TestDataFactory.ATLANTA;
import static com.ammann.coursecorrect.support.TestDataFactory.BERLIN;
import static com.ammann.coursecorrect.support.TestDataFactory.LONDON;
import static com.ammann.coursecorrect.support.TestDataFactory.MAASTRICHT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.coursecorrect.dto.ConversionResponseDTO;
import com.ammann.coursecorrect.dto.VenueCorrectionSummaryDTO;
import com.ammann.coursecorrect.enumeration.Confidence;
import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.CorrectionTableUnavailableException;
import com.ammann.coursecorrect.exception.InvalidTimeException;
import com.ammann.coursecorrect.exception.UnknownVenueException;
import com.ammann.coursecorrect.model.CorrectionTable;
import com.ammann.coursecorrect.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link TimeConversionService}.
 */
class TimeConversionServiceTest
{

    private CorrectionTableRegistry registry;
    private TimeConversionService service;

    @BeforeEach
    void setUp()
    {
        registry = new CorrectionTableRegistry();
        registry.publish(TestDataFactory.referenceTable(1L));
        service = new TimeConversionService(registry);
    }

    @Nested
    class Convert
    {
        @Test
        void convertsFastCourseTimeToSlowCourse()
        {
            ConversionResponseDTO response = service.convert("1:15:00", Gender.M, LONDON, ATLANTA);

            assertThat(response.originalSeconds()).isEqualTo(4500.0);
            assertThat(response.convertedSeconds()).isEqualTo(5675.5);
            assertThat(response.convertedTime()).isEqualTo("1:34:35");
            assertThat(response.timeDifference()).isEqualTo("0:19:35");
            assertThat(response.timeDifferenceSeconds()).isEqualTo(1175.5);
            assertThat(response.faster()).isFalse();
            assertThat(response.fromOffsetSeconds()).isEqualTo(-754.0);
            assertThat(response.toOffsetSeconds()).isEqualTo(421.5);
            assertThat(response.baselineVenue()).isEqualTo(MAASTRICHT);
            assertThat(response.gender()).isEqualTo("M");
        }

        @Test
        void slowCourseTimeBecomesFasterAtFastCourse()
        {
            ConversionResponseDTO response = service.convert("1:34:35", Gender.M, ATLANTA, LONDON);

            assertThat(response.faster()).isTrue();
            assertThat(response.convertedSeconds()).isEqualTo(5675.0 - 421.5 - 754.0);
        }

        @ParameterizedTest
        @CsvSource({"London", "Maastricht", "Atlanta"})
        void sameVenueIsIdentity(String venue)
        {
            assertThat(service.convert(4500.0, Gender.M, venue, venue)).isEqualTo(4500.0);
            assertThat(service.convert(4873.25, Gender.W, venue, venue)).isEqualTo(4873.25);
        }

        @Test
        void roundTripReturnsOriginalTime()
        {
            for (String from : List.of(LONDON, MAASTRICHT, ATLANTA)) {
                for (String to : List.of(LONDON, MAASTRICHT, ATLANTA)) {
                    double there = service.convert(4321.0, Gender.W, from, to);
                    double back = service.convert(there, Gender.W, to, from);
                    assertThat(back).isCloseTo(4321.0, within(1e-6));
                }
            }
        }

        @ParameterizedTest
        @CsvSource({"normalized", "baseline", "NORMALIZED", " Baseline "})
        void baselineAliasesTargetTheBaselineVenue(String alias)
        {
            ConversionResponseDTO response = service.convert("1:15:00", Gender.M, LONDON, alias);

            assertThat(response.toVenue()).isEqualTo(MAASTRICHT);
            assertThat(response.toOffsetSeconds()).isEqualTo(0.0);
            assertThat(response.convertedSeconds()).isEqualTo(5254.0);
        }

        @Test
        void convertedTimeBelowZeroKeepsItsSign()
        {
            // 500 - 421.5 - 754
            ConversionResponseDTO response = service.convert("8:20", Gender.M, ATLANTA, LONDON);

            assertThat(response.convertedSeconds()).isEqualTo(-675.5);
            assertThat(response.convertedTime()).isEqualTo("-0:11:15");
            assertThat(response.faster()).isTrue();
        }

        @Test
        void convertingFromBaselineToItsAliasIsIdentity()
        {
            assertThat(service.convert(4500.0, Gender.W, MAASTRICHT, "normalized")).isEqualTo(4500.0);
        }
    }

    @Nested
    class Errors
    {
        @Test
        void venueWithoutEntryForGenderIsUnknown()
        {
            assertThatThrownBy(() -> service.convert(4500.0, Gender.M, BERLIN, LONDON))
                    .isInstanceOf(UnknownVenueException.class);
            assertThatThrownBy(() -> service.convert(4500.0, Gender.M, LONDON, BERLIN))
                    .isInstanceOf(UnknownVenueException.class);
            assertThat(service.convert(4500.0, Gender.W, BERLIN, LONDON)).isEqualTo(4500.0 - 200.0 - 800.0);
        }

        @Test
        void unknownVenueIsRejectedEvenForIdentity()
        {
            assertThatThrownBy(() -> service.convert(4500.0, Gender.M, "Nowhere", "Nowhere"))
                    .isInstanceOf(UnknownVenueException.class);
        }

        @ParameterizedTest
        @CsvSource({"1:75:00", "abc", "0:00:00", "''"})
        void malformedTimeIsRejected(String time)
        {
            assertThatThrownBy(() -> service.convert(time, Gender.M, LONDON, ATLANTA))
                    .isInstanceOf(InvalidTimeException.class);
        }

        @Test
        void nonPositiveSecondsAreRejected()
        {
            assertThatThrownBy(() -> service.convert(0.0, Gender.M, LONDON, ATLANTA))
                    .isInstanceOf(InvalidTimeException.class);
            assertThatThrownBy(() -> service.convert(Double.NaN, Gender.M, LONDON, ATLANTA))
                    .isInstanceOf(InvalidTimeException.class);
        }

        @Test
        void missingTableIsUnavailable()
        {
            TimeConversionService empty = new TimeConversionService(new CorrectionTableRegistry());

            assertThatThrownBy(() -> empty.convert("1:15:00", Gender.M, LONDON, ATLANTA))
                    .isInstanceOf(CorrectionTableUnavailableException.class);
            assertThatThrownBy(empty::listVenues).isInstanceOf(CorrectionTableUnavailableException.class);
        }
    }

    @Test
    void listVenuesOrdersFastestMensCourseFirstAndWomenOnlyVenuesLast()
    {
        List<VenueCorrectionSummaryDTO> venues = service.listVenues();

        assertThat(venues).extracting(VenueCorrectionSummaryDTO::venue)
                .containsExactly(LONDON, MAASTRICHT, ATLANTA, BERLIN);

        VenueCorrectionSummaryDTO london = venues.get(0);
        assertThat(london.menCorrectionPct()).isEqualTo(15.7);
        assertThat(london.menCorrection()).isEqualTo("+15.7%");
        assertThat(london.womenCorrection()).isEqualTo("+14.8%");
        assertThat(london.sampleCount()).isEqualTo(200);
        assertThat(london.confidence()).isEqualTo(Confidence.NORMAL);
        assertThat(london.baseline()).isFalse();

        VenueCorrectionSummaryDTO maastricht = venues.get(1);
        assertThat(maastricht.baseline()).isTrue();
        assertThat(maastricht.menCorrection()).isEqualTo("0.0%");

        assertThat(venues.get(2).menCorrection()).isEqualTo("-8.8%");

        VenueCorrectionSummaryDTO berlin = venues.get(3);
        assertThat(berlin.menCorrectionPct()).isNull();
        assertThat(berlin.menCorrection()).isNull();
        assertThat(berlin.womenCorrection()).isEqualTo("-3.7%");
        assertThat(berlin.confidence()).isEqualTo(Confidence.LOW);
    }

    @Test
    void listVenuesIsDeterministic()
    {
        assertThat(service.listVenues()).isEqualTo(service.listVenues());
    }

    @Test
    void listVenuesBreaksOffsetTiesByName()
    {
        CorrectionTable table = new CorrectionTable(
                2L,
                "Bern",
                TestDataFactory.baselineMedians(),
                List.of(
                        TestDataFactory.entry("Zurich", Gender.M, 4800, 4800, 100),
                        TestDataFactory.entry("Bern", Gender.M, 4800, 4800, 100),
                        TestDataFactory.entry("Aarau", Gender.M, 4800, 4800, 100)),
                Instant.now());
        registry.publish(table);

        assertThat(service.listVenues()).extracting(VenueCorrectionSummaryDTO::venue)
                .containsExactly("Aarau", "Bern", "Zurich");
    }

    @Test
    void conversionsAreCountedPerOutcome()
    {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        service.meterRegistry = meterRegistry;
        service.initMetrics();

        service.convert("1:15:00", Gender.M, LONDON, ATLANTA);
        assertThatThrownBy(() -> service.convert("1:15:00", Gender.M, "Nowhere", ATLANTA))
                .isInstanceOf(UnknownVenueException.class);

        assertThat(meterRegistry.get("course_correct_conversions_total").tag("outcome", "converted")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("course_correct_conversions_total").tag("outcome", "rejected")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void concurrentReadersNeverMixTwoTables() throws Exception
    {
        CorrectionTable first = TestDataFactory.referenceTable(1L);
        CorrectionTable second = new CorrectionTable(
                2L,
                MAASTRICHT,
                TestDataFactory.baselineMedians(),
                List.of(
                        TestDataFactory.entry(LONDON, Gender.M, 4300, 4800, 100),
                        TestDataFactory.entry(MAASTRICHT, Gender.M, 4800, 4800, 100),
                        TestDataFactory.entry(ATLANTA, Gender.M, 5100, 4800, 100)),
                Instant.now());
        // 4500 + 754 + 421.5 with the first table, 4500 + 500 + 300 with the second
        Set<Double> allowed = Set.of(5675.5, 5300.0);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(3);
        ConcurrentLinkedQueue<Double> results = new ConcurrentLinkedQueue<>();
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                readers.add(executor.submit(() -> {
                    started.countDown();
                    while (running.get()) {
                        results.add(service.convert(4500.0, Gender.M, LONDON, ATLANTA));
                    }
                }));
            }
            started.await(5, TimeUnit.SECONDS);
            for (int i = 0; i < 2_000; i++) {
                registry.publish(i % 2 == 0 ? second : first);
            }
            running.set(false);
            for (Future<?> reader : readers) {
                reader.get(5, TimeUnit.SECONDS);
            }
        } finally {
            running.set(false);
            executor.shutdownNow();
        }

        assertThat(results).isNotEmpty().allMatch(allowed::contains);
    }
}
