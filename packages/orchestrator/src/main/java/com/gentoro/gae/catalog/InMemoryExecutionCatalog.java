package com.gentoro.gae.catalog;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryExecutionCatalog implements ExecutionCatalog {
  private final List<ExecutionRecord> records = new CopyOnWriteArrayList<>();

  @Override
  public void record(ExecutionRecord record) {
    records.add(record);
  }

  public List<ExecutionRecord> records() {
    return List.copyOf(records);
  }
}
