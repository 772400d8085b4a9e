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
 * Immutable statistics of one finished round.
 */
public class RoundStats {
  /** Round number, starting at 1 */
  private final int round;
  /** Vertices gathered and applied this round */
  private final int numActiveVertices;
  /** Edges visited by gather */
  private final long numEdgesGathered;
  /** Scatter calls that returned true */
  private final long numActivationRequests;
  /** Distinct vertices active in the next round */
  private final int numNextActiveVertices;
  /** Wall time of the round */
  private final long roundMillis;

  /**
   * Constructor
   *
   * @param round Round number
   * @param numActiveVertices Vertices applied
   * @param numEdgesGathered Edges gathered
   * @param numActivationRequests Activation requests
   * @param numNextActiveVertices Size of the next active set
   * @param roundMillis Round time
   */
  public RoundStats(int round, int numActiveVertices, long numEdgesGathered,
      long numActivationRequests, int numNextActiveVertices,
      long roundMillis) {
    this.round = round;
    this.numActiveVertices = numActiveVertices;
    this.numEdgesGathered = numEdgesGathered;
    this.numActivationRequests = numActivationRequests;
    this.numNextActiveVertices = numNextActiveVertices;
    this.roundMillis = roundMillis;
  }

  public int getRound() {
    return round;
  }

  public int getNumActiveVertices() {
    return numActiveVertices;
  }

  public long getNumEdgesGathered() {
    return numEdgesGathered;
  }

  public long getNumActivationRequests() {
    return numActivationRequests;
  }

  public int getNumNextActiveVertices() {
    return numNextActiveVertices;
  }

  public long getRoundMillis() {
    return roundMillis;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("round", round)
        .add("active", numActiveVertices)
        .add("edgesGathered", numEdgesGathered)
        .add("activationRequests", numActivationRequests)
        .add("nextActive", numNextActiveVertices)
        .add("millis", roundMillis)
        .toString();
  }
}
