package app.learngreek.core.review.domain;

/**
 * Raised when a review carries a quality rating outside {@code [1, 5]}.
 * Signals a caller bug; the rating is never clamped.
 */
public class InvalidQualityException extends IllegalArgumentException {

    private final int quality;

    public InvalidQualityException(int quality) {
        super("Quality must be between " + ReviewOutcome.MIN_QUALITY + " and " + ReviewOutcome.MAX_QUALITY
                + ", got " + quality);
        this.quality = quality;
    }

    public int getQuality() {
        return quality;
    }
}
