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
package com.cleversafe.phaselock.util;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.cleversafe.phaselock.InvariantViolationException;
import com.cleversafe.phaselock.InvariantViolationException.Invariant;
import com.cleversafe.phaselock.Options;
import com.cleversafe.phaselock.Role;
import com.cleversafe.phaselock.WorkerIdentity;
import com.cleversafe.phaselock.impl.TurnArbiter;
import com.cleversafe.phaselock.util.WorkerHarness.Report;

public class WorkerHarnessTest {
  @Test
  public void testAssignsRolesAndCountsSections() throws Exception {
    final TurnArbiter arbiter = TurnArbiter.initialize(Options.make().paranoidChecks(true));
    final Set<WorkerIdentity> seen = ConcurrentHashMap.newKeySet();
    final Set<String> threadNames = ConcurrentHashMap.newKeySet();

    final Report report;
    try (WorkerHarness harness = new WorkerHarness(arbiter, 5, "roles")) {
      report = harness.run(3, 2, 10, self -> {
        Assert.assertEquals(self.role(), Role.READER);
        seen.add(self);
        threadNames.add(Thread.currentThread().getName());
      }, self -> {
        Assert.assertEquals(self.role(), Role.WRITER);
        seen.add(self);
        threadNames.add(Thread.currentThread().getName());
      });
    }

    Assert.assertEquals(report.readSections(), 30);
    Assert.assertEquals(report.writeSections(), 20);
    Assert.assertTrue(report.elapsedNanos() > 0);
    Assert.assertEquals(report.finalState().toString(), "Read(0)");
    Assert.assertEquals(seen.size(), 5);
    Assert.assertTrue(seen.contains(WorkerIdentity.reader(2)));
    Assert.assertTrue(seen.contains(WorkerIdentity.writer(1)));
    for (final String name : threadNames) {
      Assert.assertTrue(name.startsWith("roles-worker-"), name);
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRejectsMoreWorkersThanThreads() throws Exception {
    try (WorkerHarness harness = new WorkerHarness(TurnArbiter.initialize(), 2, "small")) {
      harness.run(2, 1, 1, self -> {}, self -> {});
    }
  }

  @Test
  public void testInvariantViolationStopsRun() throws Exception {
    final TurnArbiter arbiter = TurnArbiter.initialize(Options.make().name("violating"));
    try (WorkerHarness harness = new WorkerHarness(arbiter, 1, "violating")) {
      // the section exits on its own, so the harness's exit is unmatched
      harness.run(1, 0, 1, arbiter::exitRead, self -> {});
      Assert.fail("run completed despite unmatched exit");
    } catch (final ExecutionException expected) {
      Assert.assertTrue(expected.getCause() instanceof InvariantViolationException,
          String.valueOf(expected.getCause()));
      Assert.assertEquals(((InvariantViolationException) expected.getCause()).invariant(),
          Invariant.NON_NEGATIVE_READER_COUNT);
    }
    Assert.assertEquals(arbiter.snapshot().toString(), "Read(0)");
  }

  @Test
  public void testSectionFailureStillExits() throws Exception {
    final TurnArbiter arbiter = TurnArbiter.initialize(Options.make().name("failing"));
    try (WorkerHarness harness = new WorkerHarness(arbiter, 2, "failing")) {
      harness.run(1, 1, 3, self -> {}, self -> {
        throw new IllegalStateException("write failed");
      });
      Assert.fail("run completed despite failing section");
    } catch (final ExecutionException expected) {
      Assert.assertEquals(expected.getCause().getMessage(), "write failed");
    }
    Assert.assertFalse(arbiter.snapshot().writer().isPresent());
    Assert.assertEquals(arbiter.activeReaders(), 0);
  }

  @Test
  public void testInterruptedRunCancelsWorkers() throws Exception {
    final TurnArbiter arbiter = TurnArbiter.initialize(Options.make().name("interrupted"));
    final CountDownLatch inside = new CountDownLatch(1);
    final CountDownLatch never = new CountDownLatch(1);
    final CountDownLatch cancelled = new CountDownLatch(1);
    final AtomicReference<Throwable> outcome = new AtomicReference<>();

    try (WorkerHarness harness = new WorkerHarness(arbiter, 1, "interrupted")) {
      final Thread caller = new Thread(() -> {
        try {
          harness.run(1, 0, 1, self -> {
            inside.countDown();
            try {
              never.await();
            } catch (final InterruptedException e) {
              cancelled.countDown();
              throw e;
            }
          }, self -> {});
        } catch (final Throwable t) {
          outcome.set(t);
        }
      }, "interrupted-caller");
      caller.start();
      Assert.assertTrue(inside.await(10, TimeUnit.SECONDS));

      caller.interrupt();
      caller.join(TimeUnit.SECONDS.toMillis(10));
      Assert.assertFalse(caller.isAlive());
      Assert.assertTrue(outcome.get() instanceof InterruptedException, String.valueOf(outcome.get()));
      // the harness is still open, so only the cancellation can have interrupted the section
      Assert.assertTrue(cancelled.await(10, TimeUnit.SECONDS));
    }
    Assert.assertEquals(arbiter.activeReaders(), 0);
  }
}
