package app.danki.core.deck.domain.type;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class CardTemplateConverter implements AttributeConverter<CardTemplate, String> {

    @Override
    public String convertToDatabaseColumn(CardTemplate attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public CardTemplate convertToEntityAttribute(String dbData) {
        return dbData == null ? null : CardTemplate.fromCode(dbData);
    }
}
