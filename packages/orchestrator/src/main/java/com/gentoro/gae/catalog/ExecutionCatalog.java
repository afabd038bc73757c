package com.gentoro.gae.catalog;

/** Sink for execution records. Failures surface as runtime exceptions. */
public interface ExecutionCatalog {
  void record(ExecutionRecord record);
}
