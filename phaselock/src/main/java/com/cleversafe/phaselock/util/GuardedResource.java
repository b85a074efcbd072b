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

import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.cleversafe.phaselock.AccessArbiter;
import com.cleversafe.phaselock.WorkerIdentity;
import com.google.common.base.Preconditions;

/**
 * A value reachable only through an arbiter's sections: reads run between {@code enterRead} and
 * {@code exitRead}, updates between {@code enterWrite} and {@code exitWrite}. Exits always run, so
 * enter/exit pairs stay matched even when the supplied function throws.
 */
public final class GuardedResource<T> {
  private final AccessArbiter arbiter;
  // guarded by the arbiter's sections; the arbiter mutex orders writes before later reads
  private T value;

  public GuardedResource(final AccessArbiter arbiter, final T initial) {
    this.arbiter = Preconditions.checkNotNull(arbiter, "arbiter is null");
    this.value = initial;
  }

  /**
   * Applies {@code view} to the current value inside a read section, concurrently with other
   * readers. {@code view} must not modify the value.
   */
  public <R> R read(final WorkerIdentity reader, final Function<? super T, ? extends R> view) {
    Preconditions.checkNotNull(view, "view is null");
    arbiter.enterRead(reader);
    try {
      return view.apply(value);
    } finally {
      arbiter.exitRead(reader);
    }
  }

  /**
   * Replaces the value with {@code update}'s result inside an exclusive write section.
   *
   * @return the new value
   */
  public T write(final WorkerIdentity writer, final UnaryOperator<T> update) {
    Preconditions.checkNotNull(update, "update is null");
    arbiter.enterWrite(writer);
    try {
      value = update.apply(value);
      return value;
    } finally {
      arbiter.exitWrite(writer);
    }
  }

  public AccessArbiter arbiter() {
    return arbiter;
  }
}
