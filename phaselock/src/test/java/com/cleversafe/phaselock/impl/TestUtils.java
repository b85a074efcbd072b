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

import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import org.testng.Assert;

import com.cleversafe.phaselock.AccessArbiter;
import com.cleversafe.phaselock.ArbiterState;
import com.cleversafe.phaselock.Options;

public final class TestUtils {
  private TestUtils() {}

  public static final long TIMEOUT_SECONDS = 10;

  /**
   * @return a paranoid arbiter reporting to {@code monitor}
   */
  public static TurnArbiter checkedArbiter(final String name, final RecordingMonitor monitor) {
    return TurnArbiter.initialize(Options.make().name(name).paranoidChecks(true).monitor(monitor));
  }

  /**
   * Polls the arbiter's snapshot until {@code condition} holds, failing after
   * {@link #TIMEOUT_SECONDS}.
   */
  public static ArbiterState awaitState(final AccessArbiter arbiter,
      final Predicate<ArbiterState> condition, final String description)
      throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
    ArbiterState state;
    while (!condition.test(state = arbiter.snapshot())) {
      if (System.nanoTime() - deadline > 0) {
        Assert.fail("timed out waiting for " + description + "; last state " + state
            + " pendingWriters=" + state.pendingWriters() + " waitingReaders="
            + state.waitingReaders());
      }
      Thread.sleep(1);
    }
    return state;
  }
}
