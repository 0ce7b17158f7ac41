package app.learngreek.core.review.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Stage {
    NEW("new"),
    LEARNING("learning"),
    REVIEW("review"),
    RELEARNING("relearning"),
    MASTERED("mastered"),
    /** Value written by a newer schema than this build knows about. */
    UNKNOWN("unknown");

    private final String value;

    Stage(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    public static Stage fromValue(String v) {
        if (v == null || v.isBlank()) {
            return UNKNOWN;
        }
        String normalized = v.trim().toLowerCase(Locale.ROOT);
        for (Stage stage : values()) {
            if (stage.value.equals(normalized)) {
                return stage;
            }
        }
        return UNKNOWN;
    }
}
