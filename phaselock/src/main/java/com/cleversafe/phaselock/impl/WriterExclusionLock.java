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

import com.cleversafe.phaselock.InvariantViolationException.Invariant;
import com.cleversafe.phaselock.Phase;
import com.cleversafe.phaselock.WorkerIdentity;

/**
 * The exclusion token serializing writers. A writer takes the token only while the write phase is
 * current, and each write phase admits a single writer. With fair ordering, writers take the token
 * in ticket order; otherwise in whatever order they win the arbiter mutex. The token belongs to the
 * holding writer and the thread that took it, and only that pair may release it. All methods
 * require the arbiter mutex.
 */
final class WriterExclusionLock {
  private final PhaseController phases;
  private final TurnArbiter arbiter;
  private final boolean fair;
  private WorkerIdentity holder = null;
  private Thread holderThread = null;
  private int pendingWriters = 0;
  private long nextTicket = 0;
  private long nowServing = 0;

  WriterExclusionLock(final PhaseController phases, final TurnArbiter arbiter,
      final boolean fair) {
    this.phases = phases;
    this.arbiter = arbiter;
    this.fair = fair;
  }

  /**
   * Blocks until the write phase is current and the token is free (and, if fair, this writer's
   * ticket is served), then takes the token. A writer arriving to an idle read phase claims the
   * turn for writers.
   */
  void acquire(final WorkerIdentity writer) {
    phases.checkHeld();
    final long ticket = nextTicket++;
    pendingWriters++;
    try {
      while (true) {
        arbiter.checkOpen();
        if (phases.currentPhase() == Phase.WRITE) {
          if (holder == null && (!fair || ticket == nowServing)) {
            break;
          }
        } else if (arbiter.readersDrained()) {
          // empty read generation
          phases.requestTransition(Phase.WRITE, writer);
          continue;
        }
        phases.awaitChange();
      }
    } finally {
      pendingWriters--;
    }
    holder = writer;
    holderThread = Thread.currentThread();
  }

  void release(final WorkerIdentity writer) {
    phases.checkHeld();
    if (holder == null) {
      throw arbiter.violation(Invariant.SINGLE_WRITER,
          writer + " released the exclusion token while it was free");
    }
    if (!holder.equals(writer)) {
      throw arbiter.violation(Invariant.SINGLE_WRITER,
          writer + " released the exclusion token held by " + holder);
    }
    if (holderThread != Thread.currentThread()) {
      throw arbiter.violation(Invariant.SINGLE_WRITER, writer + " released from "
          + Thread.currentThread().getName() + " but was taken on " + holderThread.getName());
    }
    holder = null;
    holderThread = null;
    nowServing++;
  }

  WorkerIdentity holder() {
    phases.checkHeld();
    return holder;
  }

  int pendingWriters() {
    phases.checkHeld();
    return pendingWriters;
  }

  /**
   * @return true if no writer holds the token or is waiting for it
   */
  boolean isIdle() {
    phases.checkHeld();
    return holder == null && pendingWriters == 0;
  }
}
