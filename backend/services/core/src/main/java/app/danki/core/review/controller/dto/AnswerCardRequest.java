package app.danki.core.review.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param rating           0/1/2 or MISSED/ALMOST/GOT_IT
 * @param answerDurationMs time spent on the answer
 * @param now              epoch seconds; server clock when absent
 */
public record AnswerCardRequest(
        @NotBlank String rating,
        @Min(0) Long answerDurationMs,
        Long now
) {}
