package app.danki.core.review.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * The study day starts at {@code rolloverHour} in {@code zone}; answers given
 * before that hour count towards the previous day.
 */
@ConfigurationProperties(prefix = "danki.study-day")
public record StudyDayProps(
        Integer rolloverHour,
        ZoneId zone
) {
    public StudyDayProps {
        rolloverHour = rolloverHour == null ? 4 : rolloverHour;
        if (rolloverHour < 0 || rolloverHour > 23) {
            throw new IllegalArgumentException("danki.study-day.rollover-hour must be within 0..23: " + rolloverHour);
        }
        zone = zone == null ? ZoneId.of("UTC") : zone;
    }
}
