package app.danki.core.deck.domain.type;

public enum CardTemplate {
    FRONT_TO_BACK("front->back"),
    BACK_TO_FRONT("back->front");

    private final String code;
    CardTemplate(String code) { this.code = code; }
    public String code() { return code; }

    public static CardTemplate fromCode(String code) {
        for (CardTemplate t : values()) {
            if (t.code.equals(code)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown card template: " + code);
    }
}
