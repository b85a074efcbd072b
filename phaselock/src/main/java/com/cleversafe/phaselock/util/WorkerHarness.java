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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cleversafe.phaselock.AccessArbiter;
import com.cleversafe.phaselock.ArbiterState;
import com.cleversafe.phaselock.InvariantViolationException;
import com.cleversafe.phaselock.WorkerIdentity;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Spawns reader and writer workers against an arbiter and runs their sections. Each worker is one
 * pool thread, so a run may use at most as many workers as the harness has threads. Workers are
 * released together once all have started.
 */
public class WorkerHarness implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerHarness.class);

  private final AccessArbiter arbiter;
  private final int threads;
  private final ExecutorService threadPool;

  public WorkerHarness(final AccessArbiter arbiter, final int threads, final String threadPrefix) {
    Preconditions.checkArgument(threads > 0, "threads must be positive: %s", threads);
    this.arbiter = Preconditions.checkNotNull(arbiter, "arbiter is null");
    this.threads = threads;
    this.threadPool = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
        .setNameFormat(threadPrefix + "-worker-%d").setDaemon(true).build());
  }

  /**
   * Work done by a worker inside one of its sections.
   */
  public interface Section {
    void run(WorkerIdentity self) throws Exception;
  }

  /**
   * Runs {@code readers} reader workers and {@code writers} writer workers (ids {@code 0..n-1} per
   * role), each performing {@code iterations} sections, and waits for all to finish.
   * <p>
   * A failing worker stops the run: the remaining workers are cancelled and the failure is rethrown.
   * Interrupting the calling thread cancels the workers the same way.
   * An {@link InvariantViolationException} is treated as fatal and logged.
   */
  public Report run(final int readers, final int writers, final int iterations,
      final Section readSection, final Section writeSection)
      throws InterruptedException, ExecutionException {
    Preconditions.checkArgument(readers >= 0 && writers >= 0, "negative worker count");
    Preconditions.checkArgument(readers + writers <= threads,
        "%s workers exceed %s harness threads", readers + writers, threads);
    Preconditions.checkArgument(iterations >= 0, "negative iterations: %s", iterations);

    final List<Callable<Void>> work = new ArrayList<>(readers + writers);
    final AtomicLong readCount = new AtomicLong();
    final AtomicLong writeCount = new AtomicLong();
    final CountDownLatch start = new CountDownLatch(readers + writers);
    // interleave roles so neither role gets a head start
    for (int i = 0; i < Math.max(readers, writers); i++) {
      if (i < readers) {
        work.add(reader(WorkerIdentity.reader(i), iterations, readSection, readCount, start));
      }
      if (i < writers) {
        work.add(writer(WorkerIdentity.writer(i), iterations, writeSection, writeCount, start));
      }
    }

    final long startTime = System.nanoTime();
    final CompletionService<Void> completion = new ExecutorCompletionService<>(threadPool);
    final List<Future<Void>> pending = new ArrayList<>(work.size());
    for (final Callable<Void> w : work) {
      pending.add(completion.submit(w));
    }
    boolean completed = false;
    try {
      for (int i = 0; i < pending.size(); i++) {
        completion.take().get();
      }
      completed = true;
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof InvariantViolationException) {
        LOGGER.error("{} worker broke an arbiter invariant, abandoning run", arbiter, e.getCause());
      }
      throw e;
    } finally {
      if (!completed) {
        for (final Future<Void> f : pending) {
          f.cancel(true);
        }
      }
    }
    return new Report(readCount.get(), writeCount.get(), System.nanoTime() - startTime,
        arbiter.snapshot());
  }

  private Callable<Void> reader(final WorkerIdentity self, final int iterations,
      final Section section, final AtomicLong count, final CountDownLatch start) {
    return () -> {
      start.countDown();
      start.await();
      for (int i = 0; i < iterations; i++) {
        arbiter.enterRead(self);
        try {
          section.run(self);
        } finally {
          arbiter.exitRead(self);
        }
        count.incrementAndGet();
      }
      return null;
    };
  }

  private Callable<Void> writer(final WorkerIdentity self, final int iterations,
      final Section section, final AtomicLong count, final CountDownLatch start) {
    return () -> {
      start.countDown();
      start.await();
      for (int i = 0; i < iterations; i++) {
        arbiter.enterWrite(self);
        try {
          section.run(self);
        } finally {
          arbiter.exitWrite(self);
        }
        count.incrementAndGet();
      }
      return null;
    };
  }

  @Override
  public void close() throws InterruptedException {
    threadPool.shutdownNow();
    if (!threadPool.awaitTermination(1, TimeUnit.MINUTES)) {
      LOGGER.warn("{} workers still running after shutdown", arbiter);
    }
  }

  public static final class Report {
    private final long readSections;
    private final long writeSections;
    private final long elapsedNanos;
    private final ArbiterState finalState;

    Report(final long readSections, final long writeSections, final long elapsedNanos,
        final ArbiterState finalState) {
      this.readSections = readSections;
      this.writeSections = writeSections;
      this.elapsedNanos = elapsedNanos;
      this.finalState = finalState;
    }

    public long readSections() {
      return readSections;
    }

    public long writeSections() {
      return writeSections;
    }

    public long elapsedNanos() {
      return elapsedNanos;
    }

    /**
     * @return the arbiter state once every worker finished
     */
    public ArbiterState finalState() {
      return finalState;
    }

    @Override
    public String toString() {
      return "Report [readSections=" + readSections + ", writeSections=" + writeSections
          + ", elapsedNanos=" + elapsedNanos + ", finalState=" + finalState + "]";
    }
  }
}
