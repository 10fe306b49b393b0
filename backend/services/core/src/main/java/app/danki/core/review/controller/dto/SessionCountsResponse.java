package app.danki.core.review.controller.dto;

public record SessionCountsResponse(
        long newCount,
        long learningCount,
        long reviewCount,
        long total
) {
    public static SessionCountsResponse of(long newCount, long learningCount, long reviewCount) {
        return new SessionCountsResponse(newCount, learningCount, reviewCount, newCount + learningCount + reviewCount);
    }
}
