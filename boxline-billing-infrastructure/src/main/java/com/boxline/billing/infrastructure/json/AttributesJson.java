package com.boxline.billing.infrastructure.json;

import com.boxline.billing.domain.model.Attributes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * TEXT column codec for {@link Attributes}: a flat JSON object of string values.
 *
 * Reading is lenient. Non-string scalars are kept as their text form, nested values are dropped,
 * and an unreadable column reads as empty so one bad row never blocks a listing.
 */
@Component
public class AttributesJson {

  private static final Logger log = LoggerFactory.getLogger(AttributesJson.class);

  private final ObjectMapper mapper;

  public AttributesJson(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public String write(Attributes attributes) {
    if (attributes == null || attributes.isEmpty()) return null;
    try {
      return mapper.writeValueAsString(attributes.asMap());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize attributes", e);
    }
  }

  public Attributes read(String json) {
    if (json == null || json.isBlank()) return Attributes.empty();
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable attributes column, treating as empty. err={}", e.getOriginalMessage());
      return Attributes.empty();
    }
    if (root == null || !root.isObject()) return Attributes.empty();

    Map<String, String> raw = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> f = it.next();
      JsonNode v = f.getValue();
      if (v != null && v.isValueNode() && !v.isNull()) {
        raw.put(f.getKey(), v.asText());
      }
    }
    return Attributes.fromRaw(raw);
  }
}
