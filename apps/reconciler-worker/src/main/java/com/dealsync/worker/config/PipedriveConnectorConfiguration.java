package com.dealsync.worker.config;

import com.dealsync.integration.pipedrive.PipedriveConnectorProperties;
import com.dealsync.integration.pipedrive.PipedriveDealClient;
import com.dealsync.integration.pipedrive.RequestPacer;
import com.dealsync.integration.pipedrive.RestPipedriveDealClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(PipedriveConnectorProperties.class)
public class PipedriveConnectorConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock pipedriveConnectorClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public RequestPacer pipedriveRequestPacer(
      PipedriveConnectorProperties properties,
      Clock pipedriveConnectorClock,
      MeterRegistry meterRegistry) {
    return new RequestPacer(
        properties.getPacing(),
        pipedriveConnectorClock,
        duration -> Thread.sleep(duration.toMillis()),
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(name = "pipedriveRestClient")
  public RestClient pipedriveRestClient(PipedriveConnectorProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(toTimeout(properties.getConnectTimeoutMs()));
    requestFactory.setReadTimeout(toTimeout(properties.getReadTimeoutMs()));
    return RestClient.builder().requestFactory(requestFactory).build();
  }

  @Bean
  @ConditionalOnMissingBean
  public PipedriveDealClient pipedriveDealClient(
      RestClient pipedriveRestClient,
      ObjectMapper objectMapper,
      PipedriveConnectorProperties properties,
      RequestPacer pipedriveRequestPacer,
      MeterRegistry meterRegistry) {
    return new RestPipedriveDealClient(
        pipedriveRestClient, objectMapper, properties, pipedriveRequestPacer, meterRegistry);
  }

  private static int toTimeout(long timeoutMs) {
    return (int) Math.min(Integer.MAX_VALUE, Math.max(100L, timeoutMs));
  }
}
