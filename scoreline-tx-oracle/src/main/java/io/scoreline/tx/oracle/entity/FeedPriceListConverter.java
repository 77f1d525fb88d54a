package io.scoreline.tx.oracle.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scoreline.tx.oracle.model.FeedPrice;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Collections;
import java.util.List;

/**
 * Stores the signed feed list of a snapshot as a JSON column.
 */
@Converter
public class FeedPriceListConverter implements AttributeConverter<List<FeedPrice>, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<List<FeedPrice>> FEED_LIST = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<FeedPrice> feeds) {
        if (feeds == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(feeds);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting feeds to JSON", e);
        }
    }

    @Override
    public List<FeedPrice> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(dbData, FEED_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error converting JSON to feeds", e);
        }
    }
}
