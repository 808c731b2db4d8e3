package com.receptionkit.backend.shared.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Stores a list of short labels (node badges) as a JSON array. Blank entries are dropped and
 * duplicates collapsed on both read and write, keeping first-seen order.
 */
@Converter
public class StringListJsonConverter implements AttributeConverter<List<String>, JsonNode> {

  private static final TypeReference<List<String>> TYPE = new TypeReference<>() {};
  private final JsonMapper mapper = JsonMapper.builder().findAndAddModules().build();

  @Override
  public JsonNode convertToDatabaseColumn(List<String> attribute) {
    List<String> normalized = normalize(attribute);
    if (normalized.isEmpty()) {
      return mapper.createArrayNode();
    }
    return mapper.valueToTree(normalized);
  }

  @Override
  public List<String> convertToEntityAttribute(JsonNode dbData) {
    if (dbData == null || dbData.isNull() || dbData.isMissingNode()) {
      return List.of();
    }
    try {
      return normalize(mapper.treeToValue(dbData, TYPE));
    } catch (JsonProcessingException exception) {
      throw new IllegalStateException("Failed to convert JSON to List<String>", exception);
    }
  }

  public static List<String> normalize(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String value : values) {
      if (StringUtils.hasText(value)) {
        unique.add(value.trim());
      }
    }
    return List.copyOf(unique);
  }
}
