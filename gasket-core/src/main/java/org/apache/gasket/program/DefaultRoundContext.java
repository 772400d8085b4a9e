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
package org.apache.gasket.program;

import org.apache.gasket.conf.GasConfiguration;

/**
 * Immutable {@link RoundContext}, one per round.
 */
public class DefaultRoundContext implements RoundContext {
  /** Round number */
  private final int round;
  /** Number of vertices */
  private final long totalNumVertices;
  /** Configuration */
  private final GasConfiguration conf;

  /**
   * Constructor
   *
   * @param round Round number
   * @param totalNumVertices Number of vertices
   * @param conf Configuration
   */
  public DefaultRoundContext(int round, long totalNumVertices,
      GasConfiguration conf) {
    this.round = round;
    this.totalNumVertices = totalNumVertices;
    this.conf = conf;
  }

  @Override
  public int getRound() {
    return round;
  }

  @Override
  public long getTotalNumVertices() {
    return totalNumVertices;
  }

  @Override
  public GasConfiguration getConf() {
    return conf;
  }
}
