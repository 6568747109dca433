package com.dealsync.worker.reconciliation;

import com.dealsync.domain.matching.CanonicalRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw deal and project payloads into {@link CanonicalRecord}s. Entries without an id are
 * dropped.
 */
@Component
public class CanonicalRecordNormalizer {
  private static final Logger log = LoggerFactory.getLogger(CanonicalRecordNormalizer.class);

  public List<CanonicalRecord> normalizeDeals(JsonNode payload) {
    List<CanonicalRecord> records = new ArrayList<>();
    for (JsonNode deal : entries(payload, "data")) {
      String id = text(deal, "id");
      if (id == null) {
        log.debug("Dropping deal without id payload={}", deal);
        continue;
      }
      String title = firstNonBlank(text(deal, "name"), text(deal, "title"));
      if (title == null) {
        log.warn("Deal missing title dealId={}", id);
      }
      records.add(new CanonicalRecord(id, title, decimal(deal.get("value")), text(deal, "currency")));
    }
    return records;
  }

  public List<CanonicalRecord> normalizeProjects(JsonNode payload) {
    List<CanonicalRecord> records = new ArrayList<>();
    for (JsonNode project : entries(payload, "items")) {
      String id = text(project, "projectId");
      if (id == null) {
        log.debug("Dropping project without projectId payload={}", project);
        continue;
      }
      JsonNode totalAmount = project.get("totalAmount");
      JsonNode taskAmount = project.path("totalTaskAmount");
      BigDecimal value;
      String currency;
      if (totalAmount != null && totalAmount.isObject()) {
        value = decimal(totalAmount.get("value"));
        currency = text(totalAmount, "currency");
      } else {
        value =
            decimal(taskAmount.get("value"))
                .add(decimal(project.path("totalExpenseAmount").get("value")));
        currency = text(taskAmount, "currency");
      }
      records.add(new CanonicalRecord(id, text(project, "name"), value, currency));
    }
    return records;
  }

  private static Iterable<JsonNode> entries(JsonNode payload, String envelopeField) {
    if (payload == null || payload.isNull() || payload.isMissingNode()) {
      return List.of();
    }
    if (payload.isArray()) {
      return payload;
    }
    JsonNode wrapped = payload.path(envelopeField);
    if (wrapped.isArray()) {
      return wrapped;
    }
    throw new IllegalArgumentException(
        "Payload must be an array or contain a " + envelopeField + " array");
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private static String firstNonBlank(String first, String second) {
    return first != null ? first : second;
  }

  private static BigDecimal decimal(JsonNode value) {
    if (value == null || value.isNull()) {
      return BigDecimal.ZERO;
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    try {
      return new BigDecimal(value.asText().trim());
    } catch (NumberFormatException ex) {
      log.debug("Unparseable amount value={}", value.asText());
      return BigDecimal.ZERO;
    }
  }
}
