package app.danki.core.review.service;

import app.danki.core.review.config.StudyDayProps;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;

@Component
public class StudyDayClock {

    private final StudyDayProps props;

    public StudyDayClock(StudyDayProps props) {
        this.props = props;
    }

    public LocalDate studyDate(long epochSeconds) {
        ZonedDateTime at = Instant.ofEpochSecond(epochSeconds).atZone(props.zone());
        if (at.getHour() < props.rolloverHour()) {
            return at.toLocalDate().minusDays(1);
        }
        return at.toLocalDate();
    }

    /**
     * Epoch seconds of the first rollover strictly after the given instant.
     */
    public long nextRollover(long epochSeconds) {
        LocalDate day = studyDate(epochSeconds);
        return day.plusDays(1)
                .atTime(props.rolloverHour(), 0)
                .atZone(props.zone())
                .toEpochSecond();
    }
}
