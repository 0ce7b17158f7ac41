package app.learngreek.core.review.service;

import app.learngreek.core.config.SrsProps;
import app.learngreek.core.review.algorithm.Sm2Calculator;
import app.learngreek.core.review.api.ItemCatalogPort;
import app.learngreek.core.review.api.ItemCatalogPort.CatalogItem;
import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.SchedulingState;
import app.learngreek.core.review.entity.SchedulingStateEntity;
import app.learngreek.core.review.readiness.AnswerTally;
import app.learngreek.core.review.readiness.CategorizedState;
import app.learngreek.core.review.readiness.ReadinessAggregator;
import app.learngreek.core.review.readiness.ReadinessResult;
import app.learngreek.core.review.repository.ReviewLogRepository;
import app.learngreek.core.review.repository.SchedulingStateRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
public class ReadinessService {

    private final SchedulingStateRepository stateRepository;
    private final ReviewLogRepository logRepository;
    private final ItemCatalogPort catalogPort;
    private final ReadinessAggregator aggregator;
    private final Sm2Calculator calculator;
    private final SrsProps props;

    public ReadinessService(SchedulingStateRepository stateRepository,
                            ReviewLogRepository logRepository,
                            ItemCatalogPort catalogPort,
                            ReadinessAggregator aggregator,
                            Sm2Calculator calculator,
                            SrsProps props) {
        this.stateRepository = stateRepository;
        this.logRepository = logRepository;
        this.catalogPort = catalogPort;
        this.aggregator = aggregator;
        this.calculator = calculator;
        this.props = props;
    }

    /**
     * Readiness over culture questions in the given categories; questions the learner has never
     * answered count as new.
     *
     * @param categories empty or {@code null} for the configured exam categories
     */
    @Transactional(readOnly = true)
    public ReadinessResult readiness(UUID learnerId, Collection<String> categories) {
        Set<String> included = normalize(categories);
        if (included.isEmpty()) {
            included = normalize(props.examCategories());
        }

        List<CatalogItem> questions = catalogPort.findCultureQuestions(included);
        if (questions.isEmpty()) {
            return aggregator.compute(List.of(), included);
        }

        List<UUID> ids = questions.stream().map(CatalogItem::itemId).toList();
        Map<UUID, SchedulingState> states = stateRepository
                .findByLearnerIdAndItemKindAndItemIdIn(learnerId, ItemKind.CULTURE_QUESTION, ids).stream()
                .collect(Collectors.toMap(SchedulingStateEntity::getItemId, SchedulingStateEntity::toState));

        SchedulingState unseen = calculator.initialState();
        List<CategorizedState> categorized = questions.stream()
                .map(q -> new CategorizedState(q.category(), states.getOrDefault(q.itemId(), unseen)))
                .toList();

        var tally = logRepository.tallyAnswers(learnerId, ItemKind.CULTURE_QUESTION, ids);
        AnswerTally answers = tally == null ? AnswerTally.NONE : new AnswerTally(tally.getTotal(), tally.getCorrect());

        return aggregator.compute(categorized, included, answers);
    }

    private static Set<String> normalize(Collection<String> categories) {
        if (categories == null) {
            return Set.of();
        }
        return categories.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
