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
package com.cleversafe.phaselock.impl;

import java.util.concurrent.atomic.AtomicInteger;

import com.cleversafe.phaselock.InvariantViolationException.Invariant;
import com.cleversafe.phaselock.Phase;
import com.cleversafe.phaselock.WorkerIdentity;

/**
 * Admits any number of concurrent readers while the read phase is current and tracks how many are
 * active. All methods except {@link #activeReaders()} require the arbiter mutex.
 */
final class ReaderAdmissionGate {
  private final PhaseController phases;
  private final TurnArbiter arbiter;
  private final AtomicInteger activeReaders = new AtomicInteger(0);
  private int waitingReaders = 0;

  ReaderAdmissionGate(final PhaseController phases, final TurnArbiter arbiter) {
    this.phases = phases;
    this.arbiter = arbiter;
  }

  /**
   * Blocks until the read phase is current, then registers the reader.
   *
   * @return the active reader count including this reader
   */
  int enter(final WorkerIdentity reader) {
    phases.checkHeld();
    waitingReaders++;
    try {
      while (true) {
        arbiter.checkOpen();
        if (phases.currentPhase() == Phase.READ) {
          break;
        }
        if (arbiter.writersIdle()) {
          // an abandoned write turn, readers take it back
          phases.requestTransition(Phase.READ, reader);
          break;
        }
        phases.awaitChange();
      }
    } finally {
      waitingReaders--;
    }
    return activeReaders.incrementAndGet();
  }

  /**
   * Deregisters a reader. The phase is left alone; see {@link #handOff}.
   *
   * @return the active reader count after this reader left
   */
  int exit(final WorkerIdentity reader) {
    phases.checkHeld();
    final int remaining = activeReaders.decrementAndGet();
    if (remaining < 0) {
      activeReaders.incrementAndGet();
      throw arbiter.violation(Invariant.NON_NEGATIVE_READER_COUNT,
          reader + " exited without a matching enter");
    }
    return remaining;
  }

  /**
   * Hands the turn to writers if {@code reader}'s exit left {@code remaining} readers at zero and a
   * writer is pending (always, under eager hand-off). The count is the value {@link #exit} returned
   * under the same hold of the mutex.
   */
  void handOff(final WorkerIdentity reader, final int remaining) {
    phases.checkHeld();
    if (remaining == 0 && (arbiter.eagerHandoff() || arbiter.writersPending())) {
      phases.requestTransition(Phase.WRITE, reader);
    }
  }

  int activeReaders() {
    return activeReaders.get();
  }

  int waitingReaders() {
    phases.checkHeld();
    return waitingReaders;
  }

  /**
   * @return true if no reader is active or waiting to be admitted
   */
  boolean isDrained() {
    phases.checkHeld();
    return activeReaders.get() == 0 && waitingReaders == 0;
  }
}
