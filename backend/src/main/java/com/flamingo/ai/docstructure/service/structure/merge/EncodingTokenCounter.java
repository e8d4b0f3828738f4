package com.flamingo.ai.docstructure.service.structure.merge;

import dev.langchain4j.model.TokenCountEstimator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** {@link TokenCounter} backed by the LangChain4j OpenAI token estimator (BPE encoding). */
@Component
@RequiredArgsConstructor
public class EncodingTokenCounter implements TokenCounter {

  private final TokenCountEstimator tokenCountEstimator;

  @Override
  public int count(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return tokenCountEstimator.estimateTokenCountInText(text);
  }
}
