/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.gasket.time;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TestFakeTime {
  @Test
  public void testAdvance() throws InterruptedException {
    FakeTime time = new FakeTime();
    long startNanos = time.getNanoseconds();
    long startMs = time.getMilliseconds();
    time.advanceMilliseconds(1500);
    assertEquals(1500, Times.getMsSince(time, startMs));
    assertEquals(1.5, Times.getSecondsSinceNanos(time, startNanos), 1e-9);
    time.sleep(500);
    assertEquals(2000, Times.getMsSince(time, startMs));
    assertEquals(2000L * Time.NS_PER_MS,
        Times.getNanosSince(time, startNanos));
  }
}
