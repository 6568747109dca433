package com.dealsync.fix.issue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads the rule engine's JSON issue list into typed {@link ValidationIssue}s. */
public class JacksonValidationIssueReader {
  private final ObjectMapper objectMapper;

  public JacksonValidationIssueReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<ValidationIssue> readAll(String rawPayload) {
    if (rawPayload == null || rawPayload.isBlank()) {
      throw new IllegalArgumentException("rawPayload must not be blank");
    }
    JsonNode root = parseRoot(rawPayload);
    JsonNode issuesNode = root.isArray() ? root : root.path("issues");
    if (!issuesNode.isArray()) {
      throw new IllegalArgumentException("Issue payload must be an array or contain an issues array");
    }
    List<ValidationIssue> issues = new ArrayList<>();
    for (JsonNode node : issuesNode) {
      issues.add(read(node));
    }
    return List.copyOf(issues);
  }

  public ValidationIssue read(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Validation issue must be a JSON object");
    }
    IssueCode code = IssueCode.fromWire(text(node, "code"));
    JsonNode metadata = node.path("metadata");
    return new ValidationIssue(
        code,
        IssueSeverity.fromWire(text(node, "severity")),
        text(node, "message"),
        payloadFor(code, metadata),
        text(node, "suggestedFix"),
        text(node, "category"));
  }

  private static IssuePayload payloadFor(IssueCode code, JsonNode metadata) {
    return switch (code) {
      case INVALID_TITLE_FORMAT ->
          new TitleFormatPayload(
              metadata.path("dealId").asLong(),
              text(metadata, "dealTitle"),
              text(metadata, "expectedTitle"),
              text(metadata, "projectCode"),
              text(metadata, "vesselName"),
              optionalLong(metadata, "pipelineId"),
              text(metadata, "status"),
              decimal(metadata, "dealValue"),
              text(metadata, "currency"),
              optionalLong(metadata, "stageId"));
      case WON_DEAL_IN_UNQUALIFIED_PIPELINE, OPEN_DEAL_IN_WRONG_PIPELINE ->
          new PipelinePlacementPayload(
              metadata.path("dealId").asLong(),
              text(metadata, "dealTitle"),
              optionalLong(metadata, "pipelineId"),
              optionalLong(metadata, "stageId"),
              text(metadata, "status"));
      case MISSING_VESSEL,
          VALUE_MISMATCH,
          QUOTE_VALUE_MISMATCH,
          QUOTE_CURRENCY_MISMATCH,
          UNRECOGNIZED -> genericPayload(metadata);
    };
  }

  private static GenericPayload genericPayload(JsonNode metadata) {
    Map<String, String> attributes = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = metadata.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isValueNode() && !field.getValue().isNull()) {
        attributes.put(field.getKey(), field.getValue().asText());
      }
    }
    String recordId = text(metadata, "dealId");
    if (recordId == null) {
      recordId = text(metadata, "recordId");
    }
    return new GenericPayload(recordId, attributes);
  }

  private JsonNode parseRoot(String rawPayload) {
    try {
      return objectMapper.readTree(rawPayload);
    } catch (Exception ex) {
      throw new IllegalArgumentException("Failed to parse validation issue JSON", ex);
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  private static Long optionalLong(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.canConvertToLong()) {
      return null;
    }
    return value.asLong();
  }

  private static BigDecimal decimal(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isNumber()) {
      return BigDecimal.ZERO;
    }
    return value.decimalValue();
  }
}
