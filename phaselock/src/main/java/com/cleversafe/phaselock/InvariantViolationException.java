/*
 * Copyright (C) 2011 the original author or authors. See the notice.md file distributed with this
 * work for additional information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package com.cleversafe.phaselock;

/**
 * Raised when a caller breaks the arbiter's usage contract, e.g. exiting a section that was never
 * entered. These are programming errors; the arbiter does not attempt to repair its state.
 */
@SuppressWarnings("serial")
public class InvariantViolationException extends IllegalStateException {
  public enum Invariant {
    /**
     * the active reader count never drops below zero
     */
    NON_NEGATIVE_READER_COUNT,
    /**
     * at most one writer holds the exclusion token, and only its holder may release it
     */
    SINGLE_WRITER,
    /**
     * no reader is active while the write phase is current
     */
    WRITE_PHASE_EXCLUDES_READERS,
    /**
     * readers are admitted only in the read phase, writers only in the write phase
     */
    PHASE_ADMISSION
  }

  private final Invariant invariant;
  private final ArbiterState state;

  public InvariantViolationException(final Invariant invariant, final ArbiterState state,
      final String message) {
    super(String.format("%s violated in state %s: %s", invariant, state, message));
    this.invariant = invariant;
    this.state = state;
  }

  public Invariant invariant() {
    return invariant;
  }

  /**
   * @return the arbiter state at the time the violation was detected
   */
  public ArbiterState state() {
    return state;
  }
}
