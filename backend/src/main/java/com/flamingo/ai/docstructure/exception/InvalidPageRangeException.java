package com.flamingo.ai.docstructure.exception;

import java.util.Locale;

/** Exception thrown when a request asks for a page range that selects no valid pages. */
public class InvalidPageRangeException extends RuntimeException {

  private final int fromPage;
  private final int toPage;

  public InvalidPageRangeException(int fromPage, int toPage) {
    super(String.format(Locale.ROOT, "Invalid page range [%d, %d)", fromPage, toPage));
    this.fromPage = fromPage;
    this.toPage = toPage;
  }

  public int getFromPage() {
    return fromPage;
  }

  public int getToPage() {
    return toPage;
  }
}
