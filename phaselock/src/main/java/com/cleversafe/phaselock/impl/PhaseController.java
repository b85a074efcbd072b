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

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.cleversafe.phaselock.AccessMonitor;
import com.cleversafe.phaselock.Phase;
import com.cleversafe.phaselock.WorkerIdentity;
import com.google.common.base.Preconditions;

/**
 * Owns the phase flag and the arbiter's wait condition. The phase is written only under the
 * arbiter mutex and read without it.
 */
final class PhaseController {
  private final ReentrantLock mutex;
  private final Condition stateChanged;
  private final AccessMonitor monitor;
  private volatile Phase phase = Phase.READ;
  private long transitions = 0;
  private boolean shutdown = false;

  PhaseController(final ReentrantLock mutex, final AccessMonitor monitor) {
    this.mutex = mutex;
    this.stateChanged = mutex.newCondition();
    this.monitor = monitor;
  }

  Phase currentPhase() {
    return phase;
  }

  long transitions() {
    checkHeld();
    return transitions;
  }

  /**
   * Flips the phase on behalf of {@code trigger} and wakes every waiting worker. Requesting the
   * phase that is already current has no effect.
   */
  void requestTransition(final Phase to, final WorkerIdentity trigger) {
    checkHeld();
    final Phase from = phase;
    if (from == to) {
      return;
    }
    phase = to;
    transitions++;
    monitor.transitioned(from, to, trigger);
    stateChanged.signalAll();
  }

  /**
   * Waits for the next state change. Callers re-check their predicate on return.
   */
  void awaitChange() {
    checkHeld();
    stateChanged.awaitUninterruptibly();
  }

  void checkOpen(final String name) {
    if (shutdown) {
      throw new IllegalStateException(name + " has been shut down");
    }
  }

  boolean isShutdown() {
    return shutdown;
  }

  void shutdown() {
    checkHeld();
    shutdown = true;
    stateChanged.signalAll();
  }

  void checkHeld() {
    Preconditions.checkState(mutex.isHeldByCurrentThread(), "arbiter mutex not held");
  }
}
