package com.dealsync.integration.pipedrive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

public class RestPipedriveDealClient implements PipedriveDealClient {
  private static final Logger log = LoggerFactory.getLogger(RestPipedriveDealClient.class);
  private static final String READ_PATH = "/api/v2/deals/";
  private static final String WRITE_PATH = "/api/v1/deals/";
  private static final String REQUEST_COUNTER = "connector.pipedrive.request";

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final PipedriveConnectorProperties properties;
  private final RequestPacer pacer;
  private final RequestPacer.Sleeper batchSleeper;
  private final MeterRegistry meterRegistry;

  public RestPipedriveDealClient(
      RestClient restClient,
      ObjectMapper objectMapper,
      PipedriveConnectorProperties properties,
      RequestPacer pacer,
      MeterRegistry meterRegistry) {
    this(
        restClient,
        objectMapper,
        properties,
        pacer,
        duration -> Thread.sleep(duration.toMillis()),
        meterRegistry);
  }

  public RestPipedriveDealClient(
      RestClient restClient,
      ObjectMapper objectMapper,
      PipedriveConnectorProperties properties,
      RequestPacer pacer,
      RequestPacer.Sleeper batchSleeper,
      MeterRegistry meterRegistry) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.pacer = Objects.requireNonNull(pacer, "pacer must not be null");
    this.batchSleeper = Objects.requireNonNull(batchSleeper, "batchSleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  @Override
  public Optional<PipedriveDeal> getDeal(PipedriveCredentials credentials, long dealId) {
    try {
      pacer.acquire();
      String body =
          restClient
              .get()
              .uri(dealUri(credentials, READ_PATH, dealId))
              .retrieve()
              .onStatus(HttpStatusCode::isError, (request, response) -> raiseApiException(response))
              .body(String.class);
      Optional<PipedriveDeal> deal = unwrapDeal(body, dealId);
      record("get_deal", deal.isPresent());
      return deal;
    } catch (PipedriveApiException ex) {
      record("get_deal", false);
      if (ex.isNotFound()) {
        log.warn("Pipedrive deal not found dealId={}", dealId);
      } else {
        log.error(
            "Failed to fetch Pipedrive deal dealId={} status={} body={}",
            dealId,
            ex.statusCode(),
            ex.responseBody());
      }
      return Optional.empty();
    } catch (RuntimeException ex) {
      record("get_deal", false);
      log.error("Error fetching Pipedrive deal dealId={} error={}", dealId, ex.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public boolean updateDealTitle(PipedriveCredentials credentials, long dealId, String title) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("title", title);
    Optional<PipedriveDeal> updated = put(credentials, dealId, fields, "update_deal_title");
    updated.ifPresent(
        deal -> log.info("Pipedrive deal title updated dealId={} newTitle={}", dealId, title));
    return updated.isPresent();
  }

  @Override
  public Optional<PipedriveDeal> updateDeal(
      PipedriveCredentials credentials, long dealId, Map<String, Object> fields) {
    Optional<PipedriveDeal> updated = put(credentials, dealId, fields, "update_deal");
    updated.ifPresent(
        deal -> log.info("Pipedrive deal updated dealId={} fields={}", dealId, fields.keySet()));
    return updated;
  }

  @Override
  public Map<Long, Boolean> batchUpdateDeals(
      PipedriveCredentials credentials, List<DealUpdate> updates) {
    Map<Long, Boolean> results = new LinkedHashMap<>();
    for (int i = 0; i < updates.size(); i++) {
      DealUpdate update = updates.get(i);
      boolean updated = updateDeal(credentials, update.dealId(), update.fields()).isPresent();
      results.put(update.dealId(), updated);
      if (i < updates.size() - 1) {
        pauseBetweenUpdates();
      }
    }
    return results;
  }

  public PacerStatus pacerStatus() {
    return pacer.status();
  }

  private Optional<PipedriveDeal> put(
      PipedriveCredentials credentials, long dealId, Map<String, Object> fields, String operation) {
    try {
      String payload = objectMapper.writeValueAsString(fields);
      pacer.acquire();
      String body =
          restClient
              .put()
              .uri(dealUri(credentials, WRITE_PATH, dealId))
              .contentType(MediaType.APPLICATION_JSON)
              .body(payload)
              .retrieve()
              .onStatus(HttpStatusCode::isError, (request, response) -> raiseApiException(response))
              .body(String.class);
      Optional<PipedriveDeal> deal = unwrapDeal(body, dealId);
      record(operation, deal.isPresent());
      return deal;
    } catch (PipedriveApiException ex) {
      record(operation, false);
      log.error(
          "Failed to update Pipedrive deal dealId={} fields={} status={} body={}",
          dealId,
          fields.keySet(),
          ex.statusCode(),
          ex.responseBody());
      return Optional.empty();
    } catch (JsonProcessingException | RuntimeException ex) {
      record(operation, false);
      log.error(
          "Error updating Pipedrive deal dealId={} fields={} error={}",
          dealId,
          fields.keySet(),
          ex.getMessage());
      return Optional.empty();
    }
  }

  private Optional<PipedriveDeal> unwrapDeal(String body, long dealId) {
    JsonNode root = parseJson(body);
    JsonNode data = root.path("data");
    if (!root.path("success").asBoolean(false) || !data.isObject()) {
      log.error(
          "Pipedrive returned error envelope dealId={} error={}",
          dealId,
          root.path("error").asText("unknown"));
      return Optional.empty();
    }
    return Optional.of(toDeal(data, dealId));
  }

  private static PipedriveDeal toDeal(JsonNode data, long fallbackId) {
    String title = optionalText(data, "title");
    if (title == null) {
      title = optionalText(data, "name");
    }
    return new PipedriveDeal(
        data.hasNonNull("id") ? data.get("id").asLong() : fallbackId,
        title,
        optionalDecimal(data, "value"),
        optionalText(data, "currency"),
        optionalText(data, "status"),
        optionalLong(data, "pipeline_id"),
        optionalLong(data, "stage_id"),
        optionalText(data, "update_time"));
  }

  private URI dealUri(PipedriveCredentials credentials, String path, long dealId) {
    String baseUrl = String.format(properties.getBaseUrlTemplate(), credentials.companyDomain());
    return UriComponentsBuilder.fromUriString(baseUrl)
        .path(path + dealId)
        .queryParam("api_token", credentials.apiKey())
        .encode()
        .build()
        .toUri();
  }

  private void raiseApiException(ClientHttpResponse response) throws IOException {
    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    throw new PipedriveApiException(response.getStatusCode().value(), body);
  }

  private JsonNode parseJson(String body) {
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to parse Pipedrive response JSON", ex);
    }
  }

  private void pauseBetweenUpdates() {
    try {
      batchSleeper.sleep(Duration.ofMillis(properties.getBatchUpdateDelayMs()));
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted between Pipedrive batch updates");
    }
  }

  private void record(String operation, boolean success) {
    meterRegistry
        .counter(REQUEST_COUNTER, "operation", operation, "outcome", success ? "success" : "error")
        .increment();
  }

  private static String optionalText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    return node.asText();
  }

  private static Long optionalLong(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull() || !node.canConvertToLong()) {
      return null;
    }
    return node.asLong();
  }

  private static BigDecimal optionalDecimal(JsonNode root, String field) {
    String text = optionalText(root, field);
    if (text == null || text.isBlank()) {
      return BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException ex) {
      return BigDecimal.ZERO;
    }
  }
}
