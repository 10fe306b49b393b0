package app.danki.core.review.controller;

import app.danki.core.review.controller.dto.AnswerCardRequest;
import app.danki.core.review.controller.dto.ReviewAnswerResponse;
import app.danki.core.review.domain.Rating;
import app.danki.core.review.ledger.ReviewEvent;
import app.danki.core.review.ledger.ReviewLedgerWriter;
import app.danki.core.review.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/review/cards/{cardId}")
public class ReviewController {

    private final ReviewService reviewService;
    private final ReviewLedgerWriter ledgerWriter;

    public ReviewController(ReviewService reviewService, ReviewLedgerWriter ledgerWriter) {
        this.reviewService = reviewService;
        this.ledgerWriter = ledgerWriter;
    }

    // POST /review/cards/{cardId}/answer
    @PostMapping("/answer")
    public ReviewAnswerResponse answer(@PathVariable UUID cardId,
                                       @Valid @RequestBody AnswerCardRequest req) {
        Rating rating = Rating.fromString(req.rating());
        long duration = req.answerDurationMs() == null ? 0L : req.answerDurationMs();
        return reviewService.review(cardId, rating, duration, req.now());
    }

    @PostMapping("/suspend")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void suspend(@PathVariable UUID cardId) {
        reviewService.suspend(cardId);
    }

    @PostMapping("/unsuspend")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unsuspend(@PathVariable UUID cardId) {
        reviewService.unsuspend(cardId);
    }

    @PostMapping("/bury")
    public Map<String, Long> bury(@PathVariable UUID cardId,
                                  @RequestParam(required = false) Long now) {
        return Map.of("buriedUntil", reviewService.bury(cardId, now));
    }

    @PostMapping("/unbury")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unbury(@PathVariable UUID cardId) {
        reviewService.unbury(cardId);
    }

    // GET /review/cards/{cardId}/history
    @GetMapping("/history")
    public List<ReviewEvent> history(@PathVariable UUID cardId) {
        return ledgerWriter.history(cardId);
    }
}
