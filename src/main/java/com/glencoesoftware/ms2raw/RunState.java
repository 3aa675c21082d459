/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Lifecycle of a {@link ConversionRun}.
 */
public enum RunState {
  /** Not started yet. */
  CREATED,
  /** Computing the plan and checking it against the budget. */
  PLANNING,
  /** Reading tiles and writing completed chunks. */
  STREAMING,
  /** Waiting for queued writes to complete. */
  DRAINING,
  /** Output complete and valid. */
  FINALIZED,
  /** Output removed after an error or cancellation. */
  FAILED;

  /**
   * @return true if the run can no longer change state
   */
  public boolean isTerminal() {
    return this == FINALIZED || this == FAILED;
  }
}
