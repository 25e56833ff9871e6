package com.rambopet.clinic_backend.enums.converter;

import com.rambopet.clinic_backend.enums.Sex;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SexConverter implements AttributeConverter<Sex, String> {

    @Override
    public String convertToDatabaseColumn(Sex sex) {
        if (sex == null) {
            return Sex.UNKNOWN.getCode();
        }
        return sex.getCode(); // single-letter column
    }

    @Override
    public Sex convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return Sex.UNKNOWN;
        }
        try {
            return Sex.fromCode(dbData);
        } catch (IllegalArgumentException e) {
            return Sex.UNKNOWN;
        }
    }
}
