package app.danki.core.deck.importer;

public record ImportSummary(
        int imported,
        int duplicates,
        int malformed
) {
}
