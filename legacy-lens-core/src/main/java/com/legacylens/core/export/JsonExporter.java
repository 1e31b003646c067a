package com.legacylens.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.model.PortfolioSummary;

/**
 * Serializes analysis values to pretty-printed JSON with snake_case property names.
 */
public class JsonExporter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(AnalysisResult result) {
        return write(result);
    }

    public String toJson(PortfolioSummary summary) {
        return write(summary);
    }

    private String write(Object value) {
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
