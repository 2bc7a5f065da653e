package com.example.aurawatch.persistence;

import com.example.aurawatch.model.SlotStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link SlotStatus} as {@code schedule} / {@code mint} / {@code finality}.
 */
@Converter(autoApply = true)
public class SlotStatusConverter implements AttributeConverter<SlotStatus, String> {

    @Override
    public String convertToDatabaseColumn(SlotStatus status) {
        return status == null ? null : status.getCode();
    }

    @Override
    public SlotStatus convertToEntityAttribute(String code) {
        return code == null ? null : SlotStatus.fromCode(code);
    }
}
