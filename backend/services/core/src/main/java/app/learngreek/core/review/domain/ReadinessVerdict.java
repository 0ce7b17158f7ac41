package app.learngreek.core.review.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReadinessVerdict {
    THOROUGHLY_PREPARED("thoroughly_prepared"),
    READY("ready"),
    GETTING_THERE("getting_there"),
    NOT_READY("not_ready");

    private final String value;

    ReadinessVerdict(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }
}
