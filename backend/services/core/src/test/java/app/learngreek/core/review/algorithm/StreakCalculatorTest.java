package app.learngreek.core.review.algorithm;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreakCalculatorTest {

    private final StreakCalculator calculator = new StreakCalculator();
    private final LocalDate today = LocalDate.of(2025, 5, 10);

    @Test
    void countsConsecutiveDaysEndingToday() {
        List<LocalDate> days = List.of(today, today.minusDays(1), today.minusDays(2), today.minusDays(5));

        assertThat(calculator.currentStreak(days, today)).isEqualTo(3);
    }

    @Test
    void noReviewToday_meansNoStreak() {
        List<LocalDate> days = List.of(today.minusDays(1), today.minusDays(2));

        assertThat(calculator.currentStreak(days, today)).isZero();
    }

    @Test
    void duplicateDaysCountOnce() {
        List<LocalDate> days = List.of(today, today, today.minusDays(1));

        assertThat(calculator.currentStreak(days, today)).isEqualTo(2);
    }

    @Test
    void emptyHistory() {
        assertThat(calculator.currentStreak(List.of(), today)).isZero();
        assertThat(calculator.currentStreak(null, today)).isZero();
    }
}
