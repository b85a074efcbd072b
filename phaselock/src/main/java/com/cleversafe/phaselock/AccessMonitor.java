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
 * Observability hook for an arbiter. Callbacks run on the worker thread while the arbiter's mutex
 * is held, so they observe a total order of events but must be quick and must never call back into
 * the arbiter.
 */
public interface AccessMonitor {
  void accessed(AccessEvent event);

  /**
   * @param trigger the worker whose action caused the flip
   */
  void transitioned(Phase from, Phase to, WorkerIdentity trigger);
}
