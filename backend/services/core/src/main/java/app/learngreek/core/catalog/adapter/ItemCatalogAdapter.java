package app.learngreek.core.catalog.adapter;

import app.learngreek.core.catalog.domain.entity.CardEntity;
import app.learngreek.core.catalog.domain.entity.CultureQuestionEntity;
import app.learngreek.core.catalog.domain.entity.DeckEntity;
import app.learngreek.core.catalog.domain.entity.DeckType;
import app.learngreek.core.catalog.repository.CardRepository;
import app.learngreek.core.catalog.repository.CultureQuestionRepository;
import app.learngreek.core.catalog.repository.DeckRepository;
import app.learngreek.core.review.api.ItemCatalogPort;
import app.learngreek.core.review.domain.ItemKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Component
public class ItemCatalogAdapter implements ItemCatalogPort {

    private final DeckRepository deckRepository;
    private final CardRepository cardRepository;
    private final CultureQuestionRepository questionRepository;

    public ItemCatalogAdapter(DeckRepository deckRepository,
                              CardRepository cardRepository,
                              CultureQuestionRepository questionRepository) {
        this.deckRepository = deckRepository;
        this.cardRepository = cardRepository;
        this.questionRepository = questionRepository;
    }

    @Override
    public Optional<CatalogItem> findItem(ItemKind kind, UUID itemId) {
        if (kind == null || itemId == null) {
            return Optional.empty();
        }
        return switch (kind) {
            case VOCABULARY_CARD -> cardRepository.findById(itemId).map(ItemCatalogAdapter::toItem);
            case CULTURE_QUESTION -> questionRepository.findById(itemId)
                    .map(q -> toItem(q, categoryOf(q.getDeckId())));
        };
    }

    @Override
    public List<CatalogItem> findNewItems(UUID learnerId, ItemKind kind, UUID deckId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return switch (kind) {
            case VOCABULARY_CARD -> {
                List<CardEntity> cards = deckId == null
                        ? cardRepository.findUnseen(learnerId, limit)
                        : cardRepository.findUnseenInDeck(learnerId, deckId, limit);
                yield cards.stream().map(ItemCatalogAdapter::toItem).toList();
            }
            case CULTURE_QUESTION -> {
                List<CultureQuestionEntity> questions = deckId == null
                        ? questionRepository.findUnseen(learnerId, limit)
                        : questionRepository.findUnseenInDeck(learnerId, deckId, limit);
                // category is not needed for queue building
                yield questions.stream().map(q -> toItem(q, null)).toList();
            }
        };
    }

    @Override
    public List<CatalogItem> findCultureQuestions(Set<String> categories) {
        if (categories == null || categories.isEmpty()) {
            return List.of();
        }
        return questionRepository.findInCategories(categories).stream()
                .map(p -> new CatalogItem(
                        p.getQuestionId(),
                        ItemKind.CULTURE_QUESTION,
                        p.getDeckId(),
                        p.getCategory(),
                        p.getOrderIndex()
                ))
                .toList();
    }

    @Override
    public Optional<Integer> findCorrectOption(UUID questionId) {
        return questionRepository.findById(questionId).map(CultureQuestionEntity::getCorrectOption);
    }

    @Override
    public long countItems(ItemKind kind) {
        return switch (kind) {
            case VOCABULARY_CARD -> cardRepository.countActive();
            case CULTURE_QUESTION -> questionRepository.countActive();
        };
    }

    @Override
    public boolean isActiveDeck(ItemKind kind, UUID deckId) {
        if (kind == null || deckId == null) {
            return false;
        }
        return deckRepository.findById(deckId)
                .filter(DeckEntity::isActive)
                .filter(d -> d.getDeckType() == deckTypeOf(kind))
                .isPresent();
    }

    private static DeckType deckTypeOf(ItemKind kind) {
        return switch (kind) {
            case VOCABULARY_CARD -> DeckType.VOCABULARY;
            case CULTURE_QUESTION -> DeckType.CULTURE;
        };
    }

    private String categoryOf(UUID deckId) {
        return deckRepository.findById(deckId).map(DeckEntity::getCategory).orElse(null);
    }

    private static CatalogItem toItem(CardEntity card) {
        return new CatalogItem(card.getCardId(), ItemKind.VOCABULARY_CARD, card.getDeckId(), null, card.getOrderIndex());
    }

    private static CatalogItem toItem(CultureQuestionEntity q, String category) {
        return new CatalogItem(q.getQuestionId(), ItemKind.CULTURE_QUESTION, q.getDeckId(), category, q.getOrderIndex());
    }
}
