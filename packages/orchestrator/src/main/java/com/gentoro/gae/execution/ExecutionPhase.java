package com.gentoro.gae.execution;

/**
 * Phases of one analysis execution, in order. Each phase is entered only from its predecessor;
 * {@link #CLEANED} is also the abort target from any phase.
 */
public enum ExecutionPhase {
  INIT,
  CREDENTIAL_READY,
  ENGINE_READY,
  GRAPH_LOADED,
  ALGORITHM_RUNNING,
  RESULTS_STORED,
  CLEANED;

  public boolean canAdvanceTo(ExecutionPhase next) {
    if (next == null || this == CLEANED) return false;
    return next == CLEANED || next.ordinal() == ordinal() + 1;
  }

  public boolean isTerminal() {
    return this == CLEANED;
  }
}
