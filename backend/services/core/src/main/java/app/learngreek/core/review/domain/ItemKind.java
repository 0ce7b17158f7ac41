package app.learngreek.core.review.domain;

public enum ItemKind {
    VOCABULARY_CARD,
    CULTURE_QUESTION
}
