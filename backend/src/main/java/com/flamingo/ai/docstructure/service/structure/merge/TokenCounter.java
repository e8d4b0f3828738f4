package com.flamingo.ai.docstructure.service.structure.merge;

/** Counts sub-word tokens; used only to bound chunk sizes. */
@FunctionalInterface
public interface TokenCounter {

  int count(String text);
}
