package com.customdim.service.storage.impl;

import com.customdim.core.model.ExtractionRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;

/** JSON array codec for the extractions column. Array order is rule order. */
final class ExtractionsJson {
    private static final TypeReference<List<ExtractionRule>> RULES = new TypeReference<>() {};

    private final ObjectMapper mapper;

    ExtractionsJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String write(List<ExtractionRule> rules) {
        try {
            return mapper.writeValueAsString(rules == null ? List.of() : rules);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Extraction encode failed", e);
        }
    }

    List<ExtractionRule> read(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ExtractionRule> rules = mapper.readValue(json, RULES);
            return rules == null ? List.of() : rules;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored extractions are not valid JSON: " + json, e);
        }
    }
}
