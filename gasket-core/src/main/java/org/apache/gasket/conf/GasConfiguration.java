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
package org.apache.gasket.conf;

import org.apache.gasket.io.GraphFormat;
import org.apache.hadoop.conf.Configuration;

/**
 * Adds user methods specific to Gasket on top of a Hadoop
 * {@link Configuration}.  The scheduler and the vertex programs read their
 * run constants from it exactly once, before the first round.
 */
public class GasConfiguration extends Configuration
    implements GasConstants {
  /**
   * Constructor that creates the configuration
   */
  public GasConfiguration() {
    this(false);
  }

  /**
   * Constructor
   *
   * @param loadDefaults Whether to load the Hadoop default resources
   */
  public GasConfiguration(boolean loadDefaults) {
    super(loadDefaults);
  }

  /**
   * Constructor.
   *
   * @param conf Configuration
   */
  public GasConfiguration(Configuration conf) {
    super(conf);
  }

  /**
   * Get the number of compute threads
   *
   * @return Number of compute threads
   */
  public int getNumComputeThreads() {
    return NUM_COMPUTE_THREADS.get(this);
  }

  /**
   * Set the number of compute threads
   *
   * @param numComputeThreads Number of compute threads to use
   */
  public void setNumComputeThreads(int numComputeThreads) {
    NUM_COMPUTE_THREADS.set(this, numComputeThreads);
  }

  public int getNumPartitions() {
    return NUM_PARTITIONS.get(this);
  }

  /**
   * Set the number of active set chunks per round
   *
   * @param numPartitions Number of chunks
   */
  public void setNumPartitions(int numPartitions) {
    NUM_PARTITIONS.set(this, numPartitions);
  }

  /**
   * Get the round ceiling.
   *
   * @return Maximum number of rounds, or a negative value for no limit
   */
  public int getMaxRounds() {
    return MAX_ROUNDS.get(this);
  }

  /**
   * Set the round ceiling.
   *
   * @param maxRounds Maximum number of rounds, negative for no limit
   */
  public void setMaxRounds(int maxRounds) {
    MAX_ROUNDS.set(this, maxRounds);
  }

  public long getMaxRunSeconds() {
    return MAX_RUN_SECONDS.get(this);
  }

  /**
   * Set the wall clock ceiling.
   *
   * @param maxRunSeconds Maximum seconds, negative for no limit
   */
  public void setMaxRunSeconds(long maxRunSeconds) {
    MAX_RUN_SECONDS.set(this, maxRunSeconds);
  }

  public boolean createMissingVertices() {
    return CREATE_MISSING_VERTICES.get(this);
  }

  /**
   * Whether the graph builder creates vertices only referenced by edges.
   *
   * @param create true to create them, false to fail on finalization
   */
  public void setCreateMissingVertices(boolean create) {
    CREATE_MISSING_VERTICES.set(this, create);
  }

  public GraphFormat getGraphFormat() {
    return GRAPH_FORMAT.get(this);
  }

  /**
   * Set the input graph format
   *
   * @param format Graph format
   */
  public void setGraphFormat(GraphFormat format) {
    GRAPH_FORMAT.set(this, format);
  }

  public String getLogLevel() {
    return LOG_LEVEL.get(this);
  }

  /**
   * Set the log level for the gasket loggers
   *
   * @param level Level name (e.g. info, debug)
   */
  public void setLogLevel(String level) {
    LOG_LEVEL.set(this, level);
  }
}
