package app.learngreek.core.review.entity;

import app.learngreek.core.review.domain.Stage;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class StageConverter implements AttributeConverter<Stage, String> {

    @Override
    public String convertToDatabaseColumn(Stage attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public Stage convertToEntityAttribute(String dbData) {
        return Stage.fromValue(dbData);
    }
}
