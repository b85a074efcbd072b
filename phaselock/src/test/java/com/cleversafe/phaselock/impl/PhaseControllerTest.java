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

import org.testng.Assert;
import org.testng.annotations.Test;

import com.cleversafe.phaselock.Phase;
import com.cleversafe.phaselock.WorkerIdentity;

public class PhaseControllerTest {
  @Test
  public void testTransitionsRequireMutex() {
    final ReentrantLock mutex = new ReentrantLock();
    final RecordingMonitor monitor = new RecordingMonitor();
    final PhaseController phases = new PhaseController(mutex, monitor);

    Assert.assertEquals(phases.currentPhase(), Phase.READ);
    try {
      phases.requestTransition(Phase.WRITE, WorkerIdentity.reader(0));
      Assert.fail("transition without the mutex");
    } catch (final IllegalStateException expected) {
    }
    Assert.assertEquals(phases.currentPhase(), Phase.READ);
    Assert.assertTrue(monitor.transitions().isEmpty());
  }

  @Test
  public void testRepeatedRequestIsNoop() {
    final ReentrantLock mutex = new ReentrantLock();
    final RecordingMonitor monitor = new RecordingMonitor();
    final PhaseController phases = new PhaseController(mutex, monitor);

    mutex.lock();
    try {
      phases.requestTransition(Phase.READ, WorkerIdentity.writer(0));
      Assert.assertEquals(phases.transitions(), 0);

      phases.requestTransition(Phase.WRITE, WorkerIdentity.reader(1));
      phases.requestTransition(Phase.WRITE, WorkerIdentity.reader(2));
      Assert.assertEquals(phases.currentPhase(), Phase.WRITE);
      Assert.assertEquals(phases.transitions(), 1);

      phases.requestTransition(Phase.READ, WorkerIdentity.writer(0));
      Assert.assertEquals(phases.transitions(), 2);
    } finally {
      mutex.unlock();
    }
    Assert.assertEquals(monitor.transitions().size(), 2);
    Assert.assertEquals(monitor.transitions().get(0), "READ->WRITE by reader-1");
    Assert.assertEquals(monitor.transitions().get(1), "WRITE->READ by writer-0");
    Assert.assertTrue(monitor.violations().isEmpty(), monitor.violations().toString());
  }

  @Test
  public void testShutdown() {
    final ReentrantLock mutex = new ReentrantLock();
    final PhaseController phases = new PhaseController(mutex, AccessMonitors.noop());

    phases.checkOpen("controller");
    mutex.lock();
    try {
      phases.shutdown();
    } finally {
      mutex.unlock();
    }
    Assert.assertTrue(phases.isShutdown());
    try {
      phases.checkOpen("controller");
      Assert.fail("open after shutdown");
    } catch (final IllegalStateException expected) {
      Assert.assertTrue(expected.getMessage().contains("controller"));
    }
  }
}
