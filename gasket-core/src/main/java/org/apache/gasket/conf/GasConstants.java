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

/**
 * Constants used all over Gasket for configuration.
 */
// CHECKSTYLE: stop InterfaceIsTypeCheck
public interface GasConstants {
  /** Number of threads used for the gather, apply and scatter phases */
  IntConfOption NUM_COMPUTE_THREADS =
      new IntConfOption("gasket.numComputeThreads", 1,
          "Number of threads for vertex computation");
  /**
   * Number of chunks the active set is split into every round. More chunks
   * than threads keeps the pool busy when vertex costs are skewed.
   */
  IntConfOption NUM_PARTITIONS =
      new IntConfOption("gasket.numPartitions", 16,
          "Number of active set chunks per round");
  /** Round ceiling, layered on top of the empty active set condition */
  IntConfOption MAX_ROUNDS =
      new IntConfOption("gasket.maxRounds", -1,
          "Maximum number of rounds to run, -1 for no limit");
  /** Wall clock ceiling, checked after every round */
  LongConfOption MAX_RUN_SECONDS =
      new LongConfOption("gasket.maxRunSeconds", -1L,
          "Maximum number of seconds to run, -1 for no limit");
  /** Minimum interval between progress log lines */
  IntConfOption PROGRESS_LOG_MSECS =
      new IntConfOption("gasket.progressLogMsecs", 30 * 1000,
          "Minimum milliseconds between progress log lines");
  /** Override the log level of the gasket loggers */
  StrConfOption LOG_LEVEL =
      new StrConfOption("gasket.logLevel", "info",
          "Override the log level for gasket loggers");

  /** What to do with an edge endpoint that was never added as a vertex */
  BooleanConfOption CREATE_MISSING_VERTICES =
      new BooleanConfOption("gasket.graph.createMissingVertices", true,
          "Create vertices referenced by edges but not added explicitly, " +
          "otherwise fail graph finalization");
  /** Input graph format */
  AbstractConfOption<GraphFormat> GRAPH_FORMAT =
      AbstractConfOption.forEnum("gasket.graph.format", GraphFormat.class,
          GraphFormat.ADJ, "The graph file format: {snap, tsv, adj}");

  /** Number of vertices in a synthetic power-law graph */
  IntConfOption POWERLAW_VERTICES =
      new IntConfOption("gasket.powerlaw.vertices", 0,
          "Generate a synthetic power-law out-degree graph of this size");
  /** Power-law exponent */
  DoubleConfOption POWERLAW_ALPHA =
      new DoubleConfOption("gasket.powerlaw.alpha", 2.1,
          "Exponent of the out-degree distribution");
  /** Maximum number of degree buckets */
  IntConfOption POWERLAW_TRUNCATE =
      new IntConfOption("gasket.powerlaw.truncate", Integer.MAX_VALUE,
          "Truncate the out-degree distribution at this many buckets");
  /** Seed for the generator */
  LongConfOption POWERLAW_SEED =
      new LongConfOption("gasket.powerlaw.seed", 1L,
          "Random seed of the synthetic graph generator");

  /** Number of files the vertex output is split into */
  IntConfOption OUTPUT_NUM_FILES =
      new IntConfOption("gasket.output.numFiles", 1,
          "Number of vertex output files");
  /** Separator between vertex id and value in text output */
  StrConfOption OUTPUT_DELIMITER =
      new StrConfOption("gasket.output.delimiter", "\t",
          "Separator between vertex id and value in text output");
}
// CHECKSTYLE: resume InterfaceIsTypeCheck
