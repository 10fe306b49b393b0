package app.danki.core.review.domain;

import app.danki.core.review.exception.InvalidRatingException;

public enum Rating {
    MISSED(0), ALMOST(1), GOT_IT(2);

    private final int code;
    Rating(int code) { this.code = code; }
    public int code() { return code; }

    public static Rating fromCode(int code) {
        for (Rating rating : values()) {
            if (rating.code == code) {
                return rating;
            }
        }
        throw new InvalidRatingException(String.valueOf(code));
    }

    /**
     * Accepts either the numeric code ("0".."2") or the name ("got_it").
     */
    public static Rating fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new InvalidRatingException(String.valueOf(v));
        }
        String trimmed = v.trim();
        if (trimmed.chars().allMatch(c -> c >= '0' && c <= '9')) {
            try {
                return fromCode(Integer.parseInt(trimmed));
            } catch (NumberFormatException ex) {
                throw new InvalidRatingException(trimmed);
            }
        }
        try {
            return Rating.valueOf(trimmed.toUpperCase());
        } catch (IllegalArgumentException ex) {
            throw new InvalidRatingException(trimmed);
        }
    }
}
