package app.learngreek.core.review.algorithm;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

@Component
public class StreakCalculator {

    /**
     * Consecutive days, ending today, with at least one review. A day without reviews
     * today means no running streak.
     */
    public int currentStreak(Collection<LocalDate> reviewDates, LocalDate today) {
        if (reviewDates == null || reviewDates.isEmpty()) {
            return 0;
        }
        Set<LocalDate> days = new HashSet<>(reviewDates);
        int streak = 0;
        LocalDate cursor = today;
        while (days.contains(cursor)) {
            streak++;
            cursor = cursor.minusDays(1);
        }
        return streak;
    }
}
