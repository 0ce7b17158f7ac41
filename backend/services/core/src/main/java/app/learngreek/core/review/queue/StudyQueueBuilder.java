package app.learngreek.core.review.queue;

import app.learngreek.core.review.domain.Stage;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Composes one study session: overdue items first (oldest first), then never-seen items in
 * catalog order, then optionally items practiced ahead of schedule.
 *
 * <p>Ordering is total over identical input, so two runs over the same data yield the
 * same queue.
 */
@Component
public class StudyQueueBuilder {

    private static final Comparator<ItemState> BY_NEXT_REVIEW = Comparator
            .comparing((ItemState i) -> i.state().nextReviewDate())
            .thenComparingLong(ItemState::creationOrder)
            .thenComparing(ItemState::itemId);

    private static final Comparator<ItemCandidate> BY_CATALOG_ORDER = Comparator
            .comparingInt(ItemCandidate::orderIndex)
            .thenComparing(ItemCandidate::itemId);

    public List<QueueEntry> build(List<ItemState> dueItems,
                                  List<ItemCandidate> newItems,
                                  int maxDue,
                                  int maxNew,
                                  LocalDate today) {
        return build(dueItems, newItems, List.of(), QueueLimits.of(maxDue, maxNew), today);
    }

    public List<QueueEntry> build(List<ItemState> dueItems,
                                  List<ItemCandidate> newItems,
                                  List<ItemState> earlyItems,
                                  QueueLimits limits,
                                  LocalDate today) {
        List<QueueEntry> out = new ArrayList<>();

        safe(dueItems).stream()
                .filter(i -> i.state().isDueOn(today))
                .sorted(BY_NEXT_REVIEW)
                .limit(limits.maxDue())
                .forEach(i -> out.add(QueueEntry.scheduled(i, false)));

        safe(newItems).stream()
                .sorted(BY_CATALOG_ORDER)
                .limit(limits.maxNew())
                .forEach(c -> out.add(QueueEntry.fresh(c)));

        if (limits.includeEarlyPractice()) {
            safe(earlyItems).stream()
                    .filter(i -> isEarlyPracticeCandidate(i, today))
                    .sorted(BY_NEXT_REVIEW)
                    .limit(limits.maxEarlyPractice())
                    .forEach(i -> out.add(QueueEntry.scheduled(i, true)));
        }

        return out;
    }

    private static boolean isEarlyPracticeCandidate(ItemState item, LocalDate today) {
        var s = item.state();
        if (s.nextReviewDate() == null || !s.nextReviewDate().isAfter(today)) {
            return false;
        }
        return s.stage() == Stage.LEARNING || s.stage() == Stage.REVIEW;
    }

    private static <T> List<T> safe(List<T> items) {
        return items == null ? List.of() : items;
    }
}
