package app.danki.core.review.config;

import app.danki.core.review.algorithm.HardIntervalMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "danki.scheduler")
public record SchedulerProps(
        Double initialEaseFactor,
        Integer firstGraduationIntervalDays,
        Integer graduatingIntervalDays,
        HardIntervalMode hardIntervalMode,
        Double hardFixedMultiplier,
        Double maximumIntervalDays,
        Integer almostStepFloorMinutes,
        Integer leechThreshold,
        Integer learningJitterSeconds
) {
    public SchedulerProps {
        initialEaseFactor = initialEaseFactor == null ? 2.5 : initialEaseFactor;
        firstGraduationIntervalDays = firstGraduationIntervalDays == null ? 6 : firstGraduationIntervalDays;
        graduatingIntervalDays = graduatingIntervalDays == null ? 1 : graduatingIntervalDays;
        hardIntervalMode = hardIntervalMode == null ? HardIntervalMode.EASE_ADJUSTED : hardIntervalMode;
        hardFixedMultiplier = hardFixedMultiplier == null ? 1.2 : hardFixedMultiplier;
        maximumIntervalDays = maximumIntervalDays == null ? 36500.0 : maximumIntervalDays;
        almostStepFloorMinutes = almostStepFloorMinutes == null ? 10 : almostStepFloorMinutes;
        leechThreshold = leechThreshold == null ? 8 : leechThreshold;
        learningJitterSeconds = learningJitterSeconds == null ? 300 : Math.max(0, learningJitterSeconds);
    }

    public static SchedulerProps defaults() {
        return new SchedulerProps(null, null, null, null, null, null, null, null, null);
    }
}
