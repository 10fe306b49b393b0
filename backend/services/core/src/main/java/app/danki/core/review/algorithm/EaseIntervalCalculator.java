package app.danki.core.review.algorithm;

import app.danki.core.review.config.SchedulerProps;
import app.danki.core.review.domain.Rating;
import org.springframework.stereotype.Component;

@Component
public class EaseIntervalCalculator {

    public static final double MINIMUM_EASE = 1.3;
    public static final double MINIMUM_REVIEW_INTERVAL_DAYS = 1.0;

    static final double ALMOST_EASE_PENALTY = 0.15;
    static final double MISSED_EASE_PENALTY = 0.8;

    private final SchedulerProps props;

    public EaseIntervalCalculator(SchedulerProps props) {
        this.props = props;
    }

    public EaseInterval next(double ease, double intervalDays, Rating rating) {
        double currentEase = Math.max(MINIMUM_EASE, ease);
        double currentInterval = Math.max(0.0, intervalDays);

        return switch (rating) {
            case GOT_IT -> {
                double candidate = clampInterval(currentInterval * currentEase);
                // a correct answer never shortens the interval
                yield new EaseInterval(currentEase, Math.max(candidate, currentInterval));
            }
            case ALMOST -> {
                double adjustedEase = Math.max(MINIMUM_EASE, currentEase - ALMOST_EASE_PENALTY);
                double multiplier = props.hardIntervalMode() == HardIntervalMode.FIXED_MULTIPLIER
                        ? props.hardFixedMultiplier()
                        : adjustedEase;
                yield new EaseInterval(adjustedEase, clampInterval(currentInterval * multiplier));
            }
            case MISSED -> new EaseInterval(Math.max(MINIMUM_EASE, currentEase - MISSED_EASE_PENALTY), currentInterval);
        };
    }

    private double clampInterval(double days) {
        return clamp(days, MINIMUM_REVIEW_INTERVAL_DAYS, props.maximumIntervalDays());
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    public record EaseInterval(double ease, double intervalDays) {
    }
}
