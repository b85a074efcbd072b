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
package com.cleversafe.phaselock.benchmark;

import java.util.Date;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.cleversafe.phaselock.AccessArbiter;
import com.cleversafe.phaselock.ArbiterState;
import com.cleversafe.phaselock.Options;
import com.cleversafe.phaselock.impl.TurnArbiter;
import com.cleversafe.phaselock.util.WorkerHarness;
import com.cleversafe.phaselock.util.WorkerHarness.Report;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

public class ArbiterBenchmark {
  private final List<String> benchmarks;
  private final int readers;
  private final int writers;
  private final int iterations;
  private final int readWork;
  private final int writeWork;
  private final boolean fairWriters;
  private final boolean eagerHandoff;

  // written in write sections, read in read sections
  private final long[] shared = new long[64];
  private volatile long sink;

  @SuppressWarnings("unchecked")
  public ArbiterBenchmark(final Map<Flag, Object> flags) {
    benchmarks = (List<String>) flags.get(Flag.benchmarks);
    readers = (Integer) flags.get(Flag.readers);
    writers = (Integer) flags.get(Flag.writers);
    iterations = (Integer) flags.get(Flag.iterations);
    readWork = (Integer) flags.get(Flag.read_work);
    writeWork = (Integer) flags.get(Flag.write_work);
    fairWriters = (Boolean) flags.get(Flag.fair_writers);
    eagerHandoff = (Boolean) flags.get(Flag.eager_handoff);
  }

  protected void run() throws InterruptedException, ExecutionException {
    printHeader();
    final int workers = readers + writers;
    for (final String benchmark : benchmarks) {
      if (benchmark.equals("alternating")) {
        runBenchmark(benchmark, readers, writers);
      } else if (benchmark.equals("readheavy")) {
        runBenchmark(benchmark, Math.max(workers - 1, 1), 1);
      } else if (benchmark.equals("writeheavy")) {
        runBenchmark(benchmark, 1, Math.max(workers - 1, 1));
      } else {
        System.err.printf("Unknown benchmark: %s\n", benchmark);
      }
    }
  }

  private void runBenchmark(final String name, final int readerCount, final int writerCount)
      throws InterruptedException, ExecutionException {
    final Options options =
        Options.make().name(name).fairWriters(fairWriters).eagerHandoff(eagerHandoff);
    final TurnArbiter arbiter = TurnArbiter.initialize(options);
    final Report report;
    try (WorkerHarness harness = new WorkerHarness(arbiter, readerCount + writerCount, name)) {
      report = harness.run(readerCount, writerCount, iterations, self -> read(), self -> write());
    } catch (InterruptedException | ExecutionException | RuntimeException e) {
      shutdownAfterFailure(arbiter, e);
      throw e;
    }
    arbiter.shutdown();

    final long sections = report.readSections() + report.writeSections();
    final double seconds = report.elapsedNanos() / 1e9;
    final ArbiterState state = report.finalState();
    System.out.printf("%-12s : %11.1f sections/s; %d readers, %d writers; %d transitions; %d ms\n",
        name, sections / seconds, readerCount, writerCount, state.transitions(),
        TimeUnit.NANOSECONDS.toMillis(report.elapsedNanos()));
  }

  /**
   * Shuts down an arbiter whose run failed. A failed run may leave the token held, in which case the
   * shutdown failure is attached to {@code failure} rather than replacing it.
   */
  static void shutdownAfterFailure(final AccessArbiter arbiter, final Exception failure) {
    try {
      arbiter.shutdown();
    } catch (final IllegalStateException busy) {
      failure.addSuppressed(busy);
    }
  }

  private void read() {
    long sum = 0;
    for (int i = 0; i < readWork; i++) {
      sum += shared[i % shared.length];
    }
    sink = sum;
  }

  private void write() {
    for (int i = 0; i < writeWork; i++) {
      shared[i % shared.length]++;
    }
  }

  private void printHeader() {
    System.out.printf("Date:       %tc\n", new Date());
    System.out.printf("CPU:        %d available processors\n",
        Runtime.getRuntime().availableProcessors());
    System.out.printf("Workers:    %d readers, %d writers\n", readers, writers);
    System.out.printf("Iterations: %d sections per worker\n", iterations);
    System.out.printf("Work:       %d reads, %d writes per section\n", readWork, writeWork);
    System.out.println(Options.make().fairWriters(fairWriters).eagerHandoff(eagerHandoff)
        .toString().replace(", ", "\n"));
    printWarnings();
    System.out.printf("------------------------------------------------\n");
  }

  void printWarnings() {
    boolean assertsEnabled = false;
    assert assertsEnabled = true; // Intentional side effect!!!
    if (assertsEnabled) {
      System.out.printf("WARNING: Assertions are enabled; benchmarks unnecessarily slow\n");
    }
    if (readers + writers > Runtime.getRuntime().availableProcessors()) {
      System.out.printf("WARNING: more workers than processors; timings include scheduling\n");
    }
  }

  public static void main(final String[] args) throws Exception {
    final Map<Flag, Object> flags;
    try {
      flags = parseFlags(args);
    } catch (final IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(1);
      return;
    }
    new ArbiterBenchmark(flags).run();
  }

  /**
   * @throws IllegalArgumentException naming the first argument that is malformed or out of range
   */
  static Map<Flag, Object> parseFlags(final String[] args) {
    final Map<Flag, Object> flags = new EnumMap<Flag, Object>(Flag.class);
    for (final Flag flag : Flag.values()) {
      flags.put(flag, flag.getDefaultValue());
    }
    for (final String arg : args) {
      boolean valid = false;
      if (arg.startsWith("--")) {
        try {
          final List<String> parts = Splitter.on("=").limit(2).splitToList(arg.substring(2));
          if (parts.size() == 2) {
            final Flag key = Flag.valueOf(parts.get(0));
            flags.put(key, key.parseValue(parts.get(1)));
            valid = true;
          }
        } catch (final IllegalArgumentException e) {
          valid = false;
        }
      }

      if (!valid) {
        throw new IllegalArgumentException("Invalid argument " + arg);
      }
    }
    if ((Integer) flags.get(Flag.readers) + (Integer) flags.get(Flag.writers) == 0) {
      throw new IllegalArgumentException(
          "Invalid argument --" + Flag.readers + "/--" + Flag.writers + ": no workers");
    }
    return flags;
  }

  private static int parseCount(final String value) {
    final int count = Integer.parseInt(value);
    Preconditions.checkArgument(count >= 0, "negative count %s", count);
    return count;
  }

  protected enum Flag {
    // Comma-separated list of workloads to run in the specified order
    //   alternating -- the configured readers and writers
    //   readheavy   -- all workers but one are readers
    //   writeheavy  -- all workers but one are writers
    benchmarks(ImmutableList.<String>of("alternating", "readheavy", "writeheavy")) {
      @Override
      public Object parseValue(final String value) {
        return ImmutableList.copyOf(Splitter.on(",").trimResults().omitEmptyStrings().split(value));
      }
    },

    // Number of reader workers
    readers(4) {
      @Override
      public Object parseValue(final String value) {
        return parseCount(value);
      }
    },

    // Number of writer workers
    writers(2) {
      @Override
      public Object parseValue(final String value) {
        return parseCount(value);
      }
    },

    // Sections performed by each worker
    iterations(10000) {
      @Override
      public Object parseValue(final String value) {
        return parseCount(value);
      }
    },

    // Loop iterations of work inside each read section
    read_work(100) {
      @Override
      public Object parseValue(final String value) {
        return parseCount(value);
      }
    },

    // Loop iterations of work inside each write section
    write_work(100) {
      @Override
      public Object parseValue(final String value) {
        return parseCount(value);
      }
    },

    // Take the exclusion token in writer arrival order
    fair_writers(false) {
      @Override
      public Object parseValue(final String value) {
        return Boolean.parseBoolean(value);
      }
    },

    // Hand the turn to writers on every last reader exit
    eager_handoff(false) {
      @Override
      public Object parseValue(final String value) {
        return Boolean.parseBoolean(value);
      }
    };

    private final Object defaultValue;

    private Flag(final Object defaultValue) {
      this.defaultValue = defaultValue;
    }

    protected abstract Object parseValue(String value);

    public Object getDefaultValue() {
      return defaultValue;
    }
  }
}
