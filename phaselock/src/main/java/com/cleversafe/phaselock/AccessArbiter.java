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
 * Arbitrates access to one shared resource between concurrent readers and exclusive writers by
 * alternating turns: a generation of readers, then one writer, and so on.
 * <p>
 * Enter and exit calls must come in matched pairs per worker invocation. Unmatched exits raise
 * {@link InvariantViolationException}. There is no timeout or cancellation; a worker that begins
 * entering a section waits until it is admitted (or the arbiter is shut down).
 * <p>
 * The turn policy does not bound a writer's wait: while readers keep entering before the active
 * reader count reaches zero, a pending writer is never admitted. Once the write phase is current no
 * new reader is admitted, so readers cannot starve writers after the flip.
 */
public interface AccessArbiter extends AutoCloseable {
  /**
   * Blocks until the read phase is current, then registers the caller as an active reader. Any
   * number of readers may be active at once.
   *
   * @throws IllegalArgumentException if {@code reader} is not a reader
   * @throws IllegalStateException if the arbiter has been shut down
   */
  void enterRead(WorkerIdentity reader);

  /**
   * Deregisters an active reader. The reader whose exit brings the count to zero hands the turn to
   * the writers.
   *
   * @throws InvariantViolationException if no reader is active
   */
  void exitRead(WorkerIdentity reader);

  /**
   * Blocks until the write phase is current and the exclusion token is free, then takes the token.
   * <p>
   * A writer that never calls {@link #exitWrite} blocks every subsequent reader and writer
   * permanently; nothing detects this.
   *
   * @throws IllegalArgumentException if {@code writer} is not a writer
   * @throws IllegalStateException if the arbiter has been shut down
   */
  void enterWrite(WorkerIdentity writer);

  /**
   * Releases the exclusion token and returns the turn to readers.
   *
   * @throws InvariantViolationException if {@code writer} does not hold the token
   */
  void exitWrite(WorkerIdentity writer);

  /**
   * Non-blocking read of the current phase.
   */
  Phase currentPhase();

  /**
   * Non-blocking read of the active reader count.
   */
  int activeReaders();

  /**
   * @return a consistent snapshot of the shared state
   */
  ArbiterState snapshot();

  /**
   * Releases the arbiter. Workers still waiting to enter are woken and fail with
   * {@link IllegalStateException}. Repeated calls have no effect.
   *
   * @throws IllegalStateException if a writer holds the token or readers are active
   */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
