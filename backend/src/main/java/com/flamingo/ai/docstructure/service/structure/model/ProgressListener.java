package com.flamingo.ai.docstructure.service.structure.model;

/**
 * Receives progress at fixed checkpoints of the pipeline. Implementations must return quickly.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NO_OP = (progress, message) -> {};

  /**
   * Reports progress.
   *
   * @param progress fraction in {@code [0, 1]}, or a negative value for message-only updates
   * @param message human readable stage description
   */
  void onProgress(double progress, String message);

  default void onMessage(String message) {
    onProgress(-1, message);
  }
}
