package app.learngreek.core.catalog.domain.entity;

public enum DeckType {
    VOCABULARY,
    CULTURE
}
