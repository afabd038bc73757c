package com.gentoro.gae.engine;

public enum EngineStatus {
  PROVISIONING,
  READY,
  STOPPED,
  ERROR
}
