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

import java.util.Locale;

import com.google.common.base.Preconditions;

/**
 * Immutable role and numeric id of a worker. Assigned once when the worker is created and used to
 * label events and to verify that the exclusion token is released by the writer holding it.
 */
public final class WorkerIdentity {
  private final Role role;
  private final int id;

  private WorkerIdentity(final Role role, final int id) {
    Preconditions.checkNotNull(role, "role cannot be null");
    Preconditions.checkArgument(id >= 0, "worker id must be non-negative: %s", id);
    this.role = role;
    this.id = id;
  }

  public static WorkerIdentity reader(final int id) {
    return new WorkerIdentity(Role.READER, id);
  }

  public static WorkerIdentity writer(final int id) {
    return new WorkerIdentity(Role.WRITER, id);
  }

  public Role role() {
    return role;
  }

  public int id() {
    return id;
  }

  public boolean isWriter() {
    return role == Role.WRITER;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof WorkerIdentity)) {
      return false;
    }
    final WorkerIdentity that = (WorkerIdentity) obj;
    return role == that.role && id == that.id;
  }

  @Override
  public int hashCode() {
    return 31 * role.hashCode() + id;
  }

  @Override
  public String toString() {
    return role.name().toLowerCase(Locale.ROOT) + "-" + id;
  }
}
