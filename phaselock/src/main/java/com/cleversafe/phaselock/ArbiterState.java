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

import java.util.Objects;
import java.util.Optional;

/**
 * A consistent snapshot of an arbiter's shared state, taken while holding the arbiter's mutex.
 * {@link #toString()} renders the state machine notation, e.g. {@code Read(3)},
 * {@code Write(none)} or {@code Write(writer-1)}.
 */
public final class ArbiterState {
  private final Phase phase;
  private final int activeReaders;
  private final WorkerIdentity writer;
  private final int pendingWriters;
  private final int waitingReaders;
  private final long transitions;

  public ArbiterState(final Phase phase, final int activeReaders, final WorkerIdentity writer,
      final int pendingWriters, final int waitingReaders, final long transitions) {
    this.phase = Objects.requireNonNull(phase, "phase cannot be null");
    this.activeReaders = activeReaders;
    this.writer = writer;
    this.pendingWriters = pendingWriters;
    this.waitingReaders = waitingReaders;
    this.transitions = transitions;
  }

  public Phase phase() {
    return phase;
  }

  public int activeReaders() {
    return activeReaders;
  }

  /**
   * @return the writer holding the exclusion token, if any
   */
  public Optional<WorkerIdentity> writer() {
    return Optional.ofNullable(writer);
  }

  /**
   * @return writers that have called {@code enterWrite} but do not hold the token yet
   */
  public int pendingWriters() {
    return pendingWriters;
  }

  /**
   * @return readers blocked in {@code enterRead} waiting for the read phase
   */
  public int waitingReaders() {
    return waitingReaders;
  }

  /**
   * @return number of phase flips since initialization
   */
  public long transitions() {
    return transitions;
  }

  /**
   * Idle means no worker is inside a section or waiting for one.
   */
  public boolean isIdle() {
    return activeReaders == 0 && writer == null && pendingWriters == 0 && waitingReaders == 0;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ArbiterState)) {
      return false;
    }
    final ArbiterState that = (ArbiterState) obj;
    return phase == that.phase && activeReaders == that.activeReaders
        && Objects.equals(writer, that.writer) && pendingWriters == that.pendingWriters
        && waitingReaders == that.waitingReaders && transitions == that.transitions;
  }

  @Override
  public int hashCode() {
    return Objects.hash(phase, activeReaders, writer, pendingWriters, waitingReaders, transitions);
  }

  @Override
  public String toString() {
    if (phase == Phase.READ) {
      return phase.displayName() + "(" + activeReaders + ")";
    }
    return phase.displayName() + "(" + (writer == null ? "none" : writer) + ")";
  }
}
