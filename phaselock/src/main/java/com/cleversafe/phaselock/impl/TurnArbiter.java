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

import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cleversafe.phaselock.AccessArbiter;
import com.cleversafe.phaselock.AccessEvent;
import com.cleversafe.phaselock.AccessEvent.Kind;
import com.cleversafe.phaselock.AccessMonitor;
import com.cleversafe.phaselock.ArbiterState;
import com.cleversafe.phaselock.InvariantViolationException;
import com.cleversafe.phaselock.InvariantViolationException.Invariant;
import com.cleversafe.phaselock.Options;
import com.cleversafe.phaselock.Phase;
import com.cleversafe.phaselock.Role;
import com.cleversafe.phaselock.WorkerIdentity;
import com.google.common.base.Preconditions;

/**
 * Turn-based {@link AccessArbiter}: a generation of concurrent readers alternates with a single
 * exclusive writer. The phase flag, the active reader count and the exclusion token are owned by
 * this object and guarded by one mutex; waits block on a condition rather than spinning.
 * <p>
 * Hand-off rules:
 * <ul>
 * <li>the reader whose exit brings the active count to zero flips to the write phase when a writer
 * is pending, or always with {@link Options#eagerHandoff()}</li>
 * <li>a writer that finds the read phase with no reader active or waiting claims the turn</li>
 * <li>a writer's exit always flips back to the read phase</li>
 * <li>a reader that finds the write phase with no writer pending or holding the token reclaims
 * the turn</li>
 * </ul>
 */
public class TurnArbiter implements AccessArbiter {
  private static final Logger LOGGER = LoggerFactory.getLogger(TurnArbiter.class);

  private final ReentrantLock mutex = new ReentrantLock();
  private final Options options;
  private final AccessMonitor monitor;
  private final PhaseController phases;
  private final ReaderAdmissionGate readers;
  private final WriterExclusionLock writers;

  private TurnArbiter(final Options options) {
    this.options = options;
    this.monitor = options.monitor();
    this.phases = new PhaseController(mutex, monitor);
    this.readers = new ReaderAdmissionGate(phases, this);
    this.writers = new WriterExclusionLock(phases, this, options.fairWriters());
  }

  /**
   * @return a new arbiter with default options, in the read phase with no active readers and the
   *         exclusion token free
   */
  public static TurnArbiter initialize() {
    return initialize(Options.make());
  }

  public static TurnArbiter initialize(final Options options) {
    Preconditions.checkNotNull(options, "options is null");
    final TurnArbiter arbiter = new TurnArbiter(Options.copy(options));
    LOGGER.info("{} initialized with {}", arbiter, arbiter.options);
    return arbiter;
  }

  @Override
  public void enterRead(final WorkerIdentity reader) {
    checkRole(reader, Role.READER);
    mutex.lock();
    try {
      final int active = readers.enter(reader);
      if (options.paranoidChecks()) {
        verifyAdmitted(reader);
      }
      monitor.accessed(new AccessEvent(Kind.ENTER_READ, reader, phases.currentPhase(), active));
    } finally {
      mutex.unlock();
    }
  }

  @Override
  public void exitRead(final WorkerIdentity reader) {
    checkRole(reader, Role.READER);
    mutex.lock();
    try {
      final int remaining = readers.exit(reader);
      monitor.accessed(new AccessEvent(Kind.EXIT_READ, reader, phases.currentPhase(), remaining));
      readers.handOff(reader, remaining);
      if (options.paranoidChecks()) {
        verifyCoherent();
      }
    } finally {
      mutex.unlock();
    }
  }

  @Override
  public void enterWrite(final WorkerIdentity writer) {
    checkRole(writer, Role.WRITER);
    mutex.lock();
    try {
      writers.acquire(writer);
      if (options.paranoidChecks()) {
        verifyAdmitted(writer);
      }
      monitor.accessed(new AccessEvent(Kind.ENTER_WRITE, writer, phases.currentPhase(),
          readers.activeReaders()));
    } finally {
      mutex.unlock();
    }
  }

  @Override
  public void exitWrite(final WorkerIdentity writer) {
    checkRole(writer, Role.WRITER);
    mutex.lock();
    try {
      writers.release(writer);
      monitor.accessed(new AccessEvent(Kind.EXIT_WRITE, writer, phases.currentPhase(),
          readers.activeReaders()));
      phases.requestTransition(Phase.READ, writer);
      if (options.paranoidChecks()) {
        verifyCoherent();
      }
    } finally {
      mutex.unlock();
    }
  }

  @Override
  public Phase currentPhase() {
    return phases.currentPhase();
  }

  @Override
  public int activeReaders() {
    return readers.activeReaders();
  }

  @Override
  public ArbiterState snapshot() {
    mutex.lock();
    try {
      return snapshotHeld();
    } finally {
      mutex.unlock();
    }
  }

  @Override
  public void shutdown() {
    mutex.lock();
    try {
      if (phases.isShutdown()) {
        return;
      }
      final ArbiterState state = snapshotHeld();
      if (state.writer().isPresent() || state.activeReaders() > 0) {
        throw new IllegalStateException("cannot shut down " + this + " in use: " + state);
      }
      phases.shutdown();
      LOGGER.info("{} shut down in state {} after {} transitions", this, state,
          state.transitions());
    } finally {
      mutex.unlock();
    }
  }

  public Options options() {
    return Options.copy(options);
  }

  @Override
  public String toString() {
    return "TurnArbiter[" + options.name() + "]";
  }

  void checkOpen() {
    phases.checkOpen(toString());
  }

  boolean eagerHandoff() {
    return options.eagerHandoff();
  }

  boolean writersPending() {
    return writers.pendingWriters() > 0;
  }

  boolean writersIdle() {
    return writers.isIdle();
  }

  boolean readersDrained() {
    return readers.isDrained();
  }

  /**
   * Builds (and logs) the failure for a broken invariant. The caller throws it.
   */
  InvariantViolationException violation(final Invariant invariant, final String message) {
    final InvariantViolationException e =
        new InvariantViolationException(invariant, snapshotHeld(), message);
    LOGGER.error("{} {}", this, e.getMessage());
    return e;
  }

  private ArbiterState snapshotHeld() {
    return new ArbiterState(phases.currentPhase(), readers.activeReaders(), writers.holder(),
        writers.pendingWriters(), readers.waitingReaders(), phases.transitions());
  }

  private void verifyAdmitted(final WorkerIdentity worker) {
    final Phase phase = phases.currentPhase();
    if (phase.admits() != worker.role()) {
      throw violation(Invariant.PHASE_ADMISSION, worker + " admitted during " + phase);
    }
    if (worker.isWriter() && !worker.equals(writers.holder())) {
      throw violation(Invariant.PHASE_ADMISSION, worker + " admitted without the token");
    }
    verifyCoherent();
  }

  private void verifyCoherent() {
    if (phases.currentPhase() == Phase.WRITE && readers.activeReaders() != 0) {
      throw violation(Invariant.WRITE_PHASE_EXCLUDES_READERS,
          readers.activeReaders() + " readers active in the write phase");
    }
  }

  private static void checkRole(final WorkerIdentity worker, final Role role) {
    Preconditions.checkNotNull(worker, "worker is null");
    Preconditions.checkArgument(worker.role() == role, "%s is not a %s", worker, role);
  }
}
