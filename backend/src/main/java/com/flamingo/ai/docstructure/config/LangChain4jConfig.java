package com.flamingo.ai.docstructure.config;

import dev.langchain4j.model.TokenCountEstimator;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j components shared by all documents. */
@Configuration
public class LangChain4jConfig {

  /**
   * Token estimator backing {@link
   * com.flamingo.ai.docstructure.service.structure.merge.TokenCounter}. Works offline; only the
   * encoding tables of the configured model are used.
   */
  @Bean
  public TokenCountEstimator tokenCountEstimator(StructureConfig structureConfig) {
    return new OpenAiTokenCountEstimator(structureConfig.getTokenizer().getModelName());
  }
}
