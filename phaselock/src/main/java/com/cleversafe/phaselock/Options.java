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

import com.cleversafe.phaselock.impl.AccessMonitors;

public class Options implements Cloneable // shallow field-for-field Object.clone
{
  private static final Options DEFAULT_OPTIONS =
      OptionsUtil.populateFromProperties("phaselock.options.", new Options(null));

  private Options(final Options that) {
    OptionsUtil.copyFields(Options.class, that, this);
  }

  /**
   * @return a new Options instance with the default parameter set
   */
  public static Options make() {
    return copy(DEFAULT_OPTIONS);
  }

  /**
   * @return a new Options instance with identical parameters as the given argument
   */
  public static Options copy(final Options other) {
    try {
      return (Options) Objects.requireNonNull(other, "copy target cannot be null").clone();
    } catch (final CloneNotSupportedException e) {
      throw new Error(e);
    }
  }

  @Override
  public String toString() {
    return OptionsUtil.toString(this);
  }

  private String name = "arbiter";
  private boolean fairWriters = false;
  private boolean eagerHandoff = false;
  private boolean paranoidChecks = false;
  private AccessMonitor monitor = AccessMonitors.noop();

  /**
   * Label used in log lines and worker thread names.
   */
  public Options name(final String name) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    return this;
  }

  /**
   * @see #name(String)
   */
  public String name() {
    return name;
  }

  /**
   * If true, writers take the exclusion token in the order they arrived in {@code enterWrite}.
   * Otherwise the order among waiting writers is unspecified.
   */
  public Options fairWriters(final boolean fairWriters) {
    this.fairWriters = fairWriters;
    return this;
  }

  /**
   * @see #fairWriters(boolean)
   */
  public boolean fairWriters() {
    return fairWriters;
  }

  /**
   * If true, the last reader to exit always flips the phase to write, even when no writer is
   * waiting. A later reader may then reclaim the idle write phase.
   * <p>
   * Defaults to false: the turn passes to writers only when one is pending, and an idle arbiter
   * rests in the read phase.
   */
  public Options eagerHandoff(final boolean eagerHandoff) {
    this.eagerHandoff = eagerHandoff;
    return this;
  }

  /**
   * @see #eagerHandoff(boolean)
   */
  public boolean eagerHandoff() {
    return eagerHandoff;
  }

  /**
   * If true, the arbiter re-verifies phase/count coherence and phase admission after every state
   * change and fails fast on any breach.
   */
  public Options paranoidChecks(final boolean paranoidChecks) {
    this.paranoidChecks = paranoidChecks;
    return this;
  }

  /**
   * @see #paranoidChecks(boolean)
   */
  public boolean paranoidChecks() {
    return paranoidChecks;
  }

  /**
   * Receives every section entry/exit and every phase flip.
   */
  public Options monitor(final AccessMonitor monitor) {
    this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
    return this;
  }

  /**
   * @see #monitor(AccessMonitor)
   */
  public AccessMonitor monitor() {
    return monitor;
  }
}
