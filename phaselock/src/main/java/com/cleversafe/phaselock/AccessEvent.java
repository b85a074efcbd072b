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

/**
 * Emitted by an arbiter at every section entry and exit. The phase and active reader count are the
 * values once the section change took effect and before any flip it causes. A flip that admits an
 * entry is reported through {@link AccessMonitor#transitioned} before the entry event; a flip caused
 * by an exit is reported after the exit event.
 */
public final class AccessEvent {
  public enum Kind {
    ENTER_READ, EXIT_READ, ENTER_WRITE, EXIT_WRITE
  }

  private final Kind kind;
  private final WorkerIdentity worker;
  private final Phase phase;
  private final int activeReaders;

  public AccessEvent(final Kind kind, final WorkerIdentity worker, final Phase phase,
      final int activeReaders) {
    this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    this.worker = Objects.requireNonNull(worker, "worker cannot be null");
    this.phase = Objects.requireNonNull(phase, "phase cannot be null");
    this.activeReaders = activeReaders;
  }

  public Kind kind() {
    return kind;
  }

  public WorkerIdentity worker() {
    return worker;
  }

  public Phase phase() {
    return phase;
  }

  public int activeReaders() {
    return activeReaders;
  }

  @Override
  public String toString() {
    return kind + " " + worker + " phase=" + phase + " activeReaders=" + activeReaders;
  }
}
