package app.danki.core.review.service;

import app.danki.core.review.api.LeechHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class LoggingLeechHandler implements LeechHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingLeechHandler.class);

    @Override
    public void onLeech(UUID cardId, UUID deckId, int lapses) {
        log.warn("Card {} in deck {} became a leech after {} lapses", cardId, deckId, lapses);
    }
}
