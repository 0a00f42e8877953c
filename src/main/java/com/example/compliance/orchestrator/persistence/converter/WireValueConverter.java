package com.example.compliance.orchestrator.persistence.converter;

import jakarta.persistence.AttributeConverter;

import java.util.function.Function;

/** Stores an enum by its lowercase wire value so SQL aggregates can filter on readable literals. */
abstract class WireValueConverter<E extends Enum<E>> implements AttributeConverter<E, String> {

    private final Function<E, String> toWire;
    private final Function<String, E> fromWire;

    WireValueConverter(Function<E, String> toWire, Function<String, E> fromWire) {
        this.toWire = toWire;
        this.fromWire = fromWire;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : toWire.apply(attribute);
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return fromWire.apply(dbData);
    }
}
