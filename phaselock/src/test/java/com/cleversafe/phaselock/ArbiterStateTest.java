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

import org.testng.Assert;
import org.testng.annotations.Test;

public class ArbiterStateTest {
  @Test
  public void testNotation() {
    Assert.assertEquals(new ArbiterState(Phase.READ, 0, null, 0, 0, 0).toString(), "Read(0)");
    Assert.assertEquals(new ArbiterState(Phase.READ, 4, null, 1, 0, 6).toString(), "Read(4)");
    Assert.assertEquals(new ArbiterState(Phase.WRITE, 0, null, 2, 3, 7).toString(),
        "Write(none)");
    Assert.assertEquals(
        new ArbiterState(Phase.WRITE, 0, WorkerIdentity.writer(9), 0, 0, 8).toString(),
        "Write(writer-9)");
  }

  @Test
  public void testIdle() {
    Assert.assertTrue(new ArbiterState(Phase.READ, 0, null, 0, 0, 0).isIdle());
    Assert.assertTrue(new ArbiterState(Phase.WRITE, 0, null, 0, 0, 1).isIdle());
    Assert.assertFalse(new ArbiterState(Phase.READ, 1, null, 0, 0, 0).isIdle());
    Assert.assertFalse(new ArbiterState(Phase.READ, 0, null, 1, 0, 0).isIdle());
    Assert.assertFalse(new ArbiterState(Phase.WRITE, 0, null, 0, 1, 0).isIdle());
    Assert.assertFalse(new ArbiterState(Phase.WRITE, 0, WorkerIdentity.writer(0), 0, 0, 1).isIdle());
  }

  @Test
  public void testEquality() {
    final ArbiterState a = new ArbiterState(Phase.WRITE, 0, WorkerIdentity.writer(1), 2, 3, 4);
    final ArbiterState b = new ArbiterState(Phase.WRITE, 0, WorkerIdentity.writer(1), 2, 3, 4);
    Assert.assertEquals(a, b);
    Assert.assertEquals(a.hashCode(), b.hashCode());
    Assert.assertNotEquals(a, new ArbiterState(Phase.WRITE, 0, WorkerIdentity.writer(2), 2, 3, 4));
  }

  @Test
  public void testWorkerIdentity() {
    Assert.assertEquals(WorkerIdentity.reader(3), WorkerIdentity.reader(3));
    Assert.assertNotEquals(WorkerIdentity.reader(3), WorkerIdentity.writer(3));
    Assert.assertEquals(WorkerIdentity.writer(12).toString(), "writer-12");
    Assert.assertEquals(WorkerIdentity.reader(5).role(), Role.READER);
    Assert.assertTrue(WorkerIdentity.writer(5).isWriter());
    Assert.assertEquals(Phase.READ.admits(), Role.READER);
    Assert.assertEquals(Phase.WRITE.admits(), Role.WRITER);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNegativeWorkerId() {
    WorkerIdentity.reader(-1);
  }
}
