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
package org.apache.gasket.io;

import java.util.Arrays;
import java.util.Random;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.GraphBuilder;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

/**
 * Generates a synthetic graph with a power-law out-degree distribution.
 * Vertices get ids 0 to n - 1. Each vertex draws k with probability
 * proportional to (k + 1)^-alpha for k below min(n, truncate) and links to
 * k + 1 uniformly random other vertices (repeats allowed).
 */
public class PowerLawGraphGenerator {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(PowerLawGraphGenerator.class);

  /** Exponent */
  private final double alpha;
  /** Maximum number of degree buckets */
  private final int truncate;
  /** Random seed */
  private final long seed;

  /**
   * Constructor
   *
   * @param conf Configuration with the powerlaw settings
   */
  public PowerLawGraphGenerator(GasConfiguration conf) {
    this(GasConfiguration.POWERLAW_ALPHA.get(conf),
        GasConfiguration.POWERLAW_TRUNCATE.get(conf),
        GasConfiguration.POWERLAW_SEED.get(conf));
  }

  /**
   * Constructor
   *
   * @param alpha Exponent, must be positive
   * @param truncate Maximum number of degree buckets, at least 1
   * @param seed Random seed
   */
  public PowerLawGraphGenerator(double alpha, int truncate, long seed) {
    Preconditions.checkArgument(alpha > 0,
        "PowerLawGraphGenerator: alpha must be positive, got %s", alpha);
    Preconditions.checkArgument(truncate >= 1,
        "PowerLawGraphGenerator: truncate must be at least 1, got %s",
        truncate);
    this.alpha = alpha;
    this.truncate = truncate;
    this.seed = seed;
  }

  /**
   * Add the vertices and edges of a generated graph.
   *
   * @param numVertices Number of vertices, at least 1
   * @param builder Graph builder
   */
  public void generate(int numVertices, GraphBuilder<?> builder) {
    Preconditions.checkArgument(numVertices >= 1,
        "generate: Need at least one vertex, got %s", numVertices);
    Random random = new Random(seed);
    double[] cdf = createCdf(Math.min(numVertices, truncate));
    for (int vertex = 0; vertex < numVertices; ++vertex) {
      builder.addVertex(vertex);
    }
    if (numVertices == 1) {
      return;
    }
    long numEdges = 0;
    for (int vertex = 0; vertex < numVertices; ++vertex) {
      int degree = sample(cdf, random) + 1;
      for (int i = 0; i < degree; ++i) {
        int target = random.nextInt(numVertices - 1);
        if (target >= vertex) {
          ++target;
        }
        builder.addEdge(vertex, target);
      }
      numEdges += degree;
    }
    if (LOG.isInfoEnabled()) {
      LOG.info("generate: Generated " + numVertices + " vertices and " +
          numEdges + " edges with alpha " + alpha);
    }
  }

  /**
   * Cumulative distribution of k over [0, numBuckets), normalized to 1.
   *
   * @param numBuckets Number of buckets
   * @return Cumulative probabilities
   */
  double[] createCdf(int numBuckets) {
    double[] cdf = new double[numBuckets];
    double sum = 0;
    for (int k = 0; k < numBuckets; ++k) {
      sum += Math.pow(k + 1, -alpha);
      cdf[k] = sum;
    }
    for (int k = 0; k < numBuckets; ++k) {
      cdf[k] /= sum;
    }
    cdf[numBuckets - 1] = 1.0;
    return cdf;
  }

  /**
   * Draw a bucket from a cumulative distribution.
   *
   * @param cdf Cumulative probabilities
   * @param random Random source
   * @return Bucket
   */
  private static int sample(double[] cdf, Random random) {
    int position = Arrays.binarySearch(cdf, random.nextDouble());
    return position >= 0 ? position : -position - 1;
  }
}
