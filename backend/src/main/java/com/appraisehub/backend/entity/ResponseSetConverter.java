package com.appraisehub.backend.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps {@link ResponseSet} to a TEXT column.
 * <p>
 * Rows written before payloads were versioned hold a flat JSON object of
 * question → answer. Those are upgraded on read: numeric values become
 * ratings, everything else a comment, and a {@code remarks} or
 * {@code managerRemarks} entry becomes the remarks.
 */
@Converter
@Slf4j
public class ResponseSetConverter implements AttributeConverter<ResponseSet, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(ResponseSet attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize evaluation responses", e);
        }
    }

    @Override
    public ResponseSet convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            JsonNode root = MAPPER.readTree(dbData);
            if (root.has("schemaVersion")) {
                return MAPPER.treeToValue(root, ResponseSet.class);
            }
            return upgradeLegacy(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored evaluation responses are not valid JSON", e);
        }
    }

    private ResponseSet upgradeLegacy(JsonNode root) {
        List<ResponseSet.Answer> answers = new ArrayList<>();
        String remarks = null;

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if ("remarks".equals(key) || "managerRemarks".equals(key)) {
                remarks = value.isNull() ? null : value.asText();
            } else if (value.isIntegralNumber()) {
                answers.add(new ResponseSet.Answer(key, value.intValue(), null));
            } else if (value.isValueNode()) {
                answers.add(new ResponseSet.Answer(key, null, value.asText()));
            } else {
                answers.add(new ResponseSet.Answer(key, null, value.toString()));
            }
        }

        log.debug("Upgraded unversioned response payload with {} answers", answers.size());
        return ResponseSet.of(answers, remarks);
    }
}
