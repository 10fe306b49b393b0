package app.danki.core.deck.importer;

import app.danki.core.deck.domain.request.AddNoteRequest;
import app.danki.core.deck.exception.DuplicateNoteException;
import app.danki.core.deck.service.NoteService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Loads notes from the bundled JSON-lines format, one object per line:
 * {@code {"front": "...", "back": "...", "meta": {...}}}. Fields other than
 * front, back and meta are kept in the note's metadata. Each note is added in
 * its own transaction, so one bad line never undoes the others.
 */
@Service
public class BundledNoteImporter {

    private static final Logger log = LoggerFactory.getLogger(BundledNoteImporter.class);
    private static final int PREVIEW_LENGTH = 80;

    private final NoteService noteService;
    private final ObjectMapper objectMapper;

    public BundledNoteImporter(NoteService noteService, ObjectMapper objectMapper) {
        this.noteService = noteService;
        this.objectMapper = objectMapper;
    }

    public ImportSummary importLines(UUID deckId, Reader source) {
        int imported = 0;
        int duplicates = 0;
        int malformed = 0;
        Set<String> seen = new HashSet<>();

        try (BufferedReader reader = new BufferedReader(source)) {
            String raw;
            int lineNo = 0;
            while ((raw = reader.readLine()) != null) {
                lineNo++;
                String line = raw.strip();
                if (line.isEmpty()) {
                    continue;
                }

                AddNoteRequest request = parse(line, lineNo);
                if (request == null) {
                    malformed++;
                    continue;
                }
                if (!seen.add(request.front() + '\u0000' + request.back())) {
                    duplicates++;
                    continue;
                }

                try {
                    noteService.addNote(deckId, request);
                    imported++;
                } catch (DuplicateNoteException ex) {
                    log.debug("Skipping line {}: {}", lineNo, ex.getReason());
                    duplicates++;
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read bundled notes for deck " + deckId, ex);
        }

        log.info("Imported bundled notes into deck {}: imported={}, duplicates={}, malformed={}",
                deckId, imported, duplicates, malformed);
        return new ImportSummary(imported, duplicates, malformed);
    }

    private AddNoteRequest parse(String line, int lineNo) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException ex) {
            log.warn("Skipping invalid JSON on line {}: {}: {}", lineNo, ex.getOriginalMessage(), preview(line));
            return null;
        }

        if (node == null || !node.isObject()
                || !node.path("front").isTextual() || !node.path("back").isTextual()
                || node.path("front").asText().isBlank() || node.path("back").asText().isBlank()) {
            log.warn("Skipping line {} without text front/back: {}", lineNo, preview(line));
            return null;
        }

        ObjectNode meta;
        if (node.path("meta").isObject()) {
            meta = ((ObjectNode) node.get("meta")).deepCopy();
        } else {
            meta = objectMapper.createObjectNode();
        }
        node.properties().forEach(e -> {
            String key = e.getKey();
            if (!"front".equals(key) && !"back".equals(key) && !"meta".equals(key)) {
                meta.set(key, e.getValue());
            }
        });

        return new AddNoteRequest(
                node.get("front").asText().strip(),
                node.get("back").asText().strip(),
                meta.isEmpty() ? null : meta
        );
    }

    private static String preview(String line) {
        return line.length() <= PREVIEW_LENGTH ? line : line.substring(0, PREVIEW_LENGTH);
    }
}
