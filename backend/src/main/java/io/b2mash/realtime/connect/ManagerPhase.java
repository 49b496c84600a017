package io.b2mash.realtime.connect;

public enum ManagerPhase {
  INITIALIZING,
  READY,
  TERMINATING,
  TERMINATED
}
