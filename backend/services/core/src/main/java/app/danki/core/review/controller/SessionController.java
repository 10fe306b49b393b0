package app.danki.core.review.controller;

import app.danki.core.review.controller.dto.BuildSessionRequest;
import app.danki.core.review.controller.dto.SessionCountsResponse;
import app.danki.core.review.service.SessionService;
import app.danki.core.review.session.SessionCard;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/review")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    // POST /review/session
    @PostMapping("/session")
    public List<SessionCard> session(@RequestBody BuildSessionRequest req) {
        return sessionService.buildSession(req.deckIds(), req.now(), req.maxNew(), req.maxReview());
    }

    // POST /review/counts
    @PostMapping("/counts")
    public SessionCountsResponse counts(@RequestBody BuildSessionRequest req) {
        return sessionService.counts(req.deckIds(), req.now());
    }
}
