package dev.scriptorium.search;

/** Why a best-effort retrieval step produced no value. */
public enum FailureReason {
  /** Turned off by configuration. */
  DISABLED,
  /** The backing service or database capability could not be used. */
  UNAVAILABLE,
  /** The step did not finish within its timeout. */
  TIMEOUT,
  /** A model could not be loaded. */
  MODEL_LOAD,
  /** The model was loaded but scoring failed. */
  INFERENCE
}
