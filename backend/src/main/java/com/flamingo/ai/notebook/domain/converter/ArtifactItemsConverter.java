package com.flamingo.ai.notebook.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

/**
 * Stores the items of a LIST artifact as a JSON array in a TEXT column. TEXT artifacts keep the
 * column null.
 */
@Converter
public class ArtifactItemsConverter implements AttributeConverter<List<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> ITEMS = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> items) {
    if (items == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(items);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize artifact items", e);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String column) {
    if (column == null) {
      return null;
    }
    try {
      return List.copyOf(MAPPER.readValue(column, ITEMS));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored artifact items are not a JSON array", e);
    }
  }
}
