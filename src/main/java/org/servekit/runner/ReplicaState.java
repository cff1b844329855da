package org.servekit.runner;

/** Lifecycle of a runner replica. {@link #READY} and {@link #FAILED} are terminal. */
public enum ReplicaState {
  UNINITIALIZED,
  LOADING,
  READY,
  FAILED
}
