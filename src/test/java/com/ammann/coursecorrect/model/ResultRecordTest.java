/* (C)2026 */
package com.ammann.coursecorrect.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.coursecorrect.enumeration.Gender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ResultRecordTest {

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    void rejectsNonPositiveOrNonFiniteTimes(double seconds) {
        assertThatThrownBy(() -> new ResultRecord("London", Gender.M, seconds))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsBlankVenueAndMissingGender() {
        assertThatThrownBy(() -> new ResultRecord(" ", Gender.M, 4000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResultRecord("London", null, 4000))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void keyCombinesVenueAndGender() {
        ResultRecord record = new ResultRecord("London", Gender.W, 4600);

        assertThat(record.key()).isEqualTo(new VenueGender("London", Gender.W));
    }

    @Test
    void entityRoundTripKeepsFields() {
        RaceResult entity = new RaceResult("London", Gender.W, 4600.5);

        assertThat(entity.toRecord()).isEqualTo(new ResultRecord("London", Gender.W, 4600.5));
    }
}
