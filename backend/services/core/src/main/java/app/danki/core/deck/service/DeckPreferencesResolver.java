package app.danki.core.deck.service;

import app.danki.core.deck.config.DeckDefaultsProps;
import app.danki.core.deck.domain.DeckPreferences;
import app.danki.core.deck.exception.InvalidDeckConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fills missing preference fields from {@link DeckDefaultsProps}, validates
 * them, and converts between the record and the stored JSON.
 */
@Component
public class DeckPreferencesResolver {

    private final DeckDefaultsProps defaults;
    private final ObjectMapper objectMapper;

    public DeckPreferencesResolver(DeckDefaultsProps defaults, ObjectMapper objectMapper) {
        this.defaults = defaults;
        this.objectMapper = objectMapper;
    }

    public DeckPreferences complete(DeckPreferences partial) {
        return merge(null, partial);
    }

    /**
     * Fields set in {@code patch} win over {@code current}; anything still
     * unset takes the configured default.
     */
    public DeckPreferences merge(DeckPreferences current, DeckPreferences patch) {
        DeckPreferences base = current == null ? new DeckPreferences(null, null, null, null, null) : current;
        DeckPreferences over = patch == null ? new DeckPreferences(null, null, null, null, null) : patch;

        DeckPreferences merged = new DeckPreferences(
                firstNonNull(over.newPerDay(), base.newPerDay(), defaults.newPerDay()),
                firstNonNull(over.revPerDay(), base.revPerDay(), defaults.revPerDay()),
                firstNonNull(over.stepsMin(), base.stepsMin(), defaults.stepsMin()),
                firstNonNull(over.interleave(), base.interleave(), defaults.interleave()),
                firstNonNull(over.bidirectional(), base.bidirectional(), defaults.bidirectional())
        );
        validate(merged);
        return new DeckPreferences(
                merged.newPerDay(),
                merged.revPerDay(),
                List.copyOf(merged.stepsMin()),
                merged.interleave(),
                merged.bidirectional()
        );
    }

    public JsonNode toJson(DeckPreferences preferences) {
        return objectMapper.valueToTree(preferences);
    }

    public DeckPreferences fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return complete(null);
        }
        try {
            return complete(objectMapper.treeToValue(json, DeckPreferences.class));
        } catch (JsonProcessingException ex) {
            throw new InvalidDeckConfigException("unreadable preferences " + json, ex);
        }
    }

    static void validate(DeckPreferences p) {
        if (p.newPerDay() < 0) {
            throw new InvalidDeckConfigException("new_per_day must be >= 0, got " + p.newPerDay());
        }
        if (p.revPerDay() < 0) {
            throw new InvalidDeckConfigException("rev_per_day must be >= 0, got " + p.revPerDay());
        }
        if (p.stepsMin().isEmpty()) {
            throw new InvalidDeckConfigException("steps_min must not be empty");
        }
        for (Integer step : p.stepsMin()) {
            if (step == null || step < 1) {
                throw new InvalidDeckConfigException("every learning step must be >= 1 minute, got " + p.stepsMin());
            }
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T v : values) {
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
