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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cleversafe.phaselock.AccessEvent;
import com.cleversafe.phaselock.AccessMonitor;
import com.cleversafe.phaselock.Phase;
import com.cleversafe.phaselock.WorkerIdentity;
import com.google.common.collect.ImmutableList;

public final class AccessMonitors {
  private AccessMonitors() {}

  private static final Logger LOGGER = LoggerFactory.getLogger(AccessMonitors.class);
  private static final AccessMonitor NOOP = new AccessMonitor() {
    @Override
    public void accessed(final AccessEvent event) {}

    @Override
    public void transitioned(final Phase from, final Phase to, final WorkerIdentity trigger) {}

    @Override
    public String toString() {
      return "noop";
    }
  };
  private static final AccessMonitor LOGGING = new AccessMonitor() {
    @Override
    public void accessed(final AccessEvent event) {
      LOGGER.debug("{} {} phase={} activeReaders={}", event.worker(), event.kind(), event.phase(),
          event.activeReaders());
    }

    @Override
    public void transitioned(final Phase from, final Phase to, final WorkerIdentity trigger) {
      LOGGER.debug("{} flipped {} -> {}", trigger, from, to);
    }

    @Override
    public String toString() {
      return "logging";
    }
  };

  public static AccessMonitor noop() {
    return NOOP;
  }

  /**
   * @return a monitor writing every event to the {@code AccessMonitors} logger at debug level
   */
  public static AccessMonitor logging() {
    return LOGGING;
  }

  /**
   * @return a monitor forwarding every event to each of {@code monitors} in order
   */
  public static AccessMonitor compose(final AccessMonitor... monitors) {
    final List<AccessMonitor> all = ImmutableList.copyOf(monitors);
    return new AccessMonitor() {
      @Override
      public void accessed(final AccessEvent event) {
        for (final AccessMonitor m : all) {
          m.accessed(event);
        }
      }

      @Override
      public void transitioned(final Phase from, final Phase to, final WorkerIdentity trigger) {
        for (final AccessMonitor m : all) {
          m.transitioned(from, to, trigger);
        }
      }

      @Override
      public String toString() {
        return "compose" + all;
      }
    };
  }
}
