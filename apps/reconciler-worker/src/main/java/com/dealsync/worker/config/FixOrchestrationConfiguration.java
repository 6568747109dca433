package com.dealsync.worker.config;

import com.dealsync.fix.handler.FixHandlerRegistry;
import com.dealsync.fix.handler.TitleFormatFixHandler;
import com.dealsync.fix.issue.JacksonValidationIssueReader;
import com.dealsync.fix.orchestrator.FixOrchestrationConfig;
import com.dealsync.integration.pipedrive.PipedriveDealClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FixOrchestrationProperties.class)
public class FixOrchestrationConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public FixOrchestrationConfig fixOrchestrationConfig(FixOrchestrationProperties properties) {
    return properties.toConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public TitleFormatFixHandler titleFormatFixHandler(PipedriveDealClient pipedriveDealClient) {
    return new TitleFormatFixHandler(pipedriveDealClient);
  }

  @Bean
  @ConditionalOnMissingBean
  public FixHandlerRegistry fixHandlerRegistry(TitleFormatFixHandler titleFormatFixHandler) {
    return new FixHandlerRegistry(titleFormatFixHandler);
  }

  @Bean
  @ConditionalOnMissingBean
  public JacksonValidationIssueReader validationIssueReader(ObjectMapper objectMapper) {
    return new JacksonValidationIssueReader(objectMapper);
  }
}
