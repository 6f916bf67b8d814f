package com.boxline.billing.infrastructure.json;

import com.boxline.billing.domain.model.Attributes;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AttributesJsonTest {

  private final AttributesJson json = new AttributesJson(new ObjectMapper());

  @Test
  void emptyAttributesAreStoredAsNull() {
    assertThat(json.write(Attributes.empty())).isNull();
    assertThat(json.read(null)).isEqualTo(Attributes.empty());
  }

  @Test
  void typedValuesAreReadBack() {
    UUID plan = UUID.randomUUID();
    Instant ends = Instant.parse("2025-04-01T00:00:00Z");
    Attributes in = Attributes.empty()
        .with(Attributes.PLAN_ID, plan)
        .with(Attributes.ENDS_AT, ends)
        .with(Attributes.AMOUNT, 1500L);

    Attributes out = json.read(json.write(in));

    assertThat(out).isEqualTo(in);
    assertThat(out.get(Attributes.PLAN_ID)).contains(plan);
    assertThat(out.get(Attributes.ENDS_AT)).contains(ends);
  }

  @Test
  void numbersAndUnknownKeysFromOtherWritersAreKept() {
    Attributes out = json.read("{\"count\": 81, \"limit\": 75, \"legacy_flag\": true, \"nested\": {\"a\": 1}}");

    assertThat(out.get(Attributes.COUNT)).contains(81L);
    assertThat(out.asMap()).containsEntry("legacy_flag", "true").doesNotContainKey("nested");
  }

  @Test
  void unreadableColumnReadsAsEmpty() {
    assertThat(json.read("{not json")).isEqualTo(Attributes.empty());
    assertThat(json.read("[1,2]")).isEqualTo(Attributes.empty());
  }
}
