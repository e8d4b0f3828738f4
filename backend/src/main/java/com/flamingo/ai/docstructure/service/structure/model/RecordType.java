package com.flamingo.ai.docstructure.service.structure.model;

/** Kind of an {@link IndexRecord}. */
public enum RecordType {
  TEXT,
  TABLE,
  IMAGE
}
