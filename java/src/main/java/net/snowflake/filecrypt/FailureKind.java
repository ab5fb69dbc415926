package net.snowflake.filecrypt;

/**
 * Coarse classification of a per-file failure.
 */
public enum FailureKind {
  /** Stream or filesystem failure, including cancellation and file replacement. */
  IO,
  /** Key access or cipher failure. */
  SECURITY,
  /** Anything else; the original message is preserved. */
  UNKNOWN
}
