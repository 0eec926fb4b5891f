/* (C)2026 */
package com.ammann.coursecorrect.model;

import static com.ammann.coursecorrect.support.TestDataFactory.ATLANTA;
import static com.ammann.coursecorrect.support.TestDataFactory.BERLIN;
import static com.ammann.coursecorrect.support.TestDataFactory.LONDON;
import static com.ammann.coursecorrect.support.TestDataFactory.MAASTRICHT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.UnknownVenueException;
import com.ammann.coursecorrect.support.TestDataFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CorrectionTableTest {

    @Test
    void entriesAreOrderedByVenueThenGender() {
        CorrectionTable table = TestDataFactory.referenceTable(1L);

        assertThat(table.getEntries())
                .extracting(CorrectionEntry::key)
                .containsExactly(
                        new VenueGender(ATLANTA, Gender.M),
                        new VenueGender(ATLANTA, Gender.W),
                        new VenueGender(BERLIN, Gender.W),
                        new VenueGender(LONDON, Gender.M),
                        new VenueGender(LONDON, Gender.W),
                        new VenueGender(MAASTRICHT, Gender.M),
                        new VenueGender(MAASTRICHT, Gender.W));
        assertThat(table.getVenues()).containsExactly(ATLANTA, BERLIN, LONDON, MAASTRICHT);
        assertThat(table.size()).isEqualTo(7);
    }

    @Test
    void findAndRequireLookUpPerGender() {
        CorrectionTable table = TestDataFactory.referenceTable(1L);

        assertThat(table.find(LONDON, Gender.M)).get()
                .extracting(CorrectionEntry::offsetSeconds)
                .isEqualTo(-754.0);
        assertThat(table.find(BERLIN, Gender.M)).isEmpty();
        assertThatThrownBy(() -> table.require(BERLIN, Gender.M))
                .isInstanceOf(UnknownVenueException.class)
                .hasMessageContaining("Berlin")
                .hasMessageContaining("M");
    }

    @Test
    void rejectsDuplicateEntries() {
        CorrectionEntry entry = TestDataFactory.entry(LONDON, Gender.M, 4046, 4800, 100);

        assertThatThrownBy(() -> new CorrectionTable(
                        1L, MAASTRICHT, TestDataFactory.baselineMedians(), List.of(entry, entry), Instant.now()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void isUnaffectedByLaterChangesToTheSourceList() {
        List<CorrectionEntry> entries = new ArrayList<>(TestDataFactory.referenceTable(1L).getEntries());
        CorrectionTable table = new CorrectionTable(
                2L, MAASTRICHT, TestDataFactory.baselineMedians(), entries, Instant.now());

        entries.clear();
        table.getEntries().clear();

        assertThat(table.size()).isEqualTo(7);
        assertThatThrownBy(() -> table.getBaselineMedians().put(Gender.M, 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
