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
package org.apache.gasket.scheduler;

import com.google.common.base.MoreObjects;

/**
 * Outcome of a run.
 */
public class RunSummary {
  /** Rounds executed */
  private final int numRounds;
  /** Total apply invocations */
  private final long numUpdates;
  /** Wall time of the run */
  private final double elapsedSeconds;
  /** Why the run stopped */
  private final TerminationReason terminationReason;

  /**
   * Constructor
   *
   * @param numRounds Rounds executed
   * @param numUpdates Apply invocations
   * @param elapsedSeconds Wall time
   * @param terminationReason Why the run stopped
   */
  public RunSummary(int numRounds, long numUpdates, double elapsedSeconds,
      TerminationReason terminationReason) {
    this.numRounds = numRounds;
    this.numUpdates = numUpdates;
    this.elapsedSeconds = elapsedSeconds;
    this.terminationReason = terminationReason;
  }

  public int getNumRounds() {
    return numRounds;
  }

  public long getNumUpdates() {
    return numUpdates;
  }

  public double getElapsedSeconds() {
    return elapsedSeconds;
  }

  public TerminationReason getTerminationReason() {
    return terminationReason;
  }

  /**
   * Apply throughput.
   *
   * @return Updates per second, 0 if no time elapsed
   */
  public double getUpdatesPerSecond() {
    return elapsedSeconds > 0 ? numUpdates / elapsedSeconds : 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("rounds", numRounds)
        .add("updates", numUpdates)
        .add("seconds", elapsedSeconds)
        .add("reason", terminationReason)
        .toString();
  }
}
