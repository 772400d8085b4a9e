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
package org.apache.gasket.examples;

import org.apache.gasket.conf.DoubleConfOption;
import org.apache.hadoop.conf.Configuration;

import com.google.common.base.Preconditions;

/**
 * Configuration options for PageRank algorithm
 */
public class PageRankSettings {
  /** Probability of a random jump, added to every rank on apply. */
  public static final DoubleConfOption RESET_PROB = new DoubleConfOption(
      "gasket.pagerank.resetProb", 0.15, "Random reset probability");
  /**
   * A vertex whose rank moved by more than this activates its
   * out-neighbors.
   */
  public static final DoubleConfOption CONVERGENCE_THRESHOLD =
      new DoubleConfOption("gasket.pagerank.convergenceThreshold", 1e-2,
          "Rank change above which neighbors are activated");

  /** Don't construct */
  protected PageRankSettings() { }

  /**
   * Get the reset probability
   *
   * @param conf Configuration
   * @return reset probability, in (0, 1)
   */
  public static double getResetProb(Configuration conf) {
    double resetProb = RESET_PROB.get(conf);
    Preconditions.checkArgument(resetProb > 0 && resetProb < 1,
        "getResetProb: %s must be in (0, 1), got %s", RESET_PROB.getKey(),
        resetProb);
    return resetProb;
  }

  /**
   * Get the convergence threshold
   *
   * @param conf Configuration
   * @return The convergence threshold, positive
   */
  public static double getConvergenceThreshold(Configuration conf) {
    double threshold = CONVERGENCE_THRESHOLD.get(conf);
    Preconditions.checkArgument(threshold > 0,
        "getConvergenceThreshold: %s must be positive, got %s",
        CONVERGENCE_THRESHOLD.getKey(), threshold);
    return threshold;
  }
}
