package com.flamingo.ai.docstructure.service.structure.vision;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.LlmServiceException;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds a vision-capable chat model for the model name a request selects through {@code
 * layout_recognize}.
 */
@Component
@Slf4j
public class VisionModelFactory {

  private final String apiKey;
  private final String baseUrl;
  private final StructureConfig structureConfig;

  public VisionModelFactory(
      @Value("${langchain4j.openai.api-key:}") String apiKey,
      @Value("${langchain4j.openai.base-url:}") String baseUrl,
      StructureConfig structureConfig) {
    this.apiKey = apiKey;
    this.baseUrl = baseUrl;
    this.structureConfig = structureConfig;
  }

  /**
   * Creates a client for the named model.
   *
   * @param modelName vision model name, e.g. {@code gpt-4o}
   * @return a client ready to describe images
   * @throws LlmServiceException if no API key is configured
   */
  public VisionModelClient create(String modelName) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new LlmServiceException(
          "Vision model " + modelName + " requested but no OpenAI API key is configured");
    }
    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .timeout(Duration.ofSeconds(structureConfig.getVision().getTimeoutSeconds()))
            .logRequests(false)
            .logResponses(false);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    log.debug("Created vision model client for {}", modelName);
    return new VisionModelClient(builder.build(), modelName);
  }
}
