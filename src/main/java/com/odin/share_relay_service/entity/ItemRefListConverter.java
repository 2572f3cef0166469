package com.odin.share_relay_service.entity;

import com.odin.share_relay_service.dto.ItemRef;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores the ordered item refs of a share as one comma-joined column. Item keys never contain commas.
 */
@Converter
public class ItemRefListConverter implements AttributeConverter<List<ItemRef>, String> {

    private static final String SEPARATOR = ",";

    @Override
    public String convertToDatabaseColumn(List<ItemRef> refs) {
        if (refs == null || refs.isEmpty()) {
            return "";
        }
        return refs.stream().map(ItemRef::getKey).collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public List<ItemRef> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(column.split(SEPARATOR))
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .map(ItemRef::of)
                .collect(Collectors.toList());
    }
}
