package com.gentoro.reformat.model;

/** Terminal state of one item in an export run. */
public enum ItemStatus {
  /** Output written; may still carry warnings. */
  COMPLETED,
  /** Item could not be processed; {@link ItemResult#error()} explains why. */
  FAILED,
  /** Never started because the run was cancelled. */
  CANCELED
}
