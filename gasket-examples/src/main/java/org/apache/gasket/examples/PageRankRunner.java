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

import java.io.IOException;
import java.util.List;

import org.apache.commons.cli.BasicParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.DefaultVertexValueFactory;
import org.apache.gasket.graph.GraphBuilder;
import org.apache.gasket.graph.InMemoryGraphStore;
import org.apache.gasket.io.GraphFormat;
import org.apache.gasket.io.GraphLoader;
import org.apache.gasket.io.PowerLawGraphGenerator;
import org.apache.gasket.scheduler.RunSummary;
import org.apache.gasket.scheduler.SynchronousScheduler;
import org.apache.gasket.utils.ConfigurationUtils;
import org.apache.gasket.utils.LoggerUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;
import org.apache.log4j.Logger;

/**
 * Loads or generates a graph, runs {@link PageRankVertexProgram} on it
 * until no vertex is active and optionally saves the ranks.
 */
public class PageRankRunner implements Tool {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(PageRankRunner.class);

  /** Writable conf */
  private Configuration conf;
  /** Summary of the last run, null before */
  private RunSummary lastSummary;
  /** Rank sum of the last run */
  private double lastRankSum;

  @Override
  public Configuration getConf() {
    return conf;
  }

  @Override
  public void setConf(Configuration conf) {
    this.conf = conf;
  }

  public RunSummary getLastSummary() {
    return lastSummary;
  }

  public double getLastRankSum() {
    return lastRankSum;
  }

  /**
   * Options of this runner.
   *
   * @return Options
   */
  static Options createOptions() {
    Options options = ConfigurationUtils.createOptions();
    options.addOption("g", "graph", true,
        "Graph file, directory or file prefix");
    options.addOption("f", "format", true, "Graph format: snap, tsv or adj");
    options.addOption("pl", "powerlaw", true,
        "Generate a synthetic power-law graph with this many vertices");
    options.addOption("sp", "saveprefix", true,
        "Save the ranks to files starting with this prefix");
    options.addOption("rp", "resetProb", true,
        "Random reset probability (" + PageRankSettings.RESET_PROB.getKey() +
        ")");
    options.addOption("ct", "threshold", true,
        "Convergence threshold (" +
        PageRankSettings.CONVERGENCE_THRESHOLD.getKey() + ")");
    return options;
  }

  @Override
  public int run(String[] args) throws Exception {
    if (null == getConf()) {
      conf = new Configuration();
    }
    Options options = createOptions();
    CommandLine cmd;
    try {
      cmd = new BasicParser().parse(options, args);
    } catch (ParseException e) {
      LOG.error("run: " + e.getMessage());
      ConfigurationUtils.printHelp(getClass().getSimpleName(), options);
      return -1;
    }
    if (cmd.hasOption("h")) {
      ConfigurationUtils.printHelp(getClass().getSimpleName(), options);
      return 0;
    }
    if (cmd.hasOption("g") == cmd.hasOption("pl")) {
      LOG.error("run: Exactly one of --graph and --powerlaw is required");
      ConfigurationUtils.printHelp(getClass().getSimpleName(), options);
      return -1;
    }

    GasConfiguration gasConf = new GasConfiguration(getConf());
    try {
      populateConfiguration(gasConf, cmd);
    } catch (IllegalArgumentException e) {
      LOG.error("run: Invalid argument: " + e.getMessage());
      return -1;
    }
    LoggerUtils.setLogLevel(gasConf);

    InMemoryGraphStore<PageRankState> graph;
    try {
      graph = loadGraph(gasConf, cmd);
    } catch (IOException | IllegalArgumentException e) {
      LOG.error("run: Failed to load the graph", e);
      return -1;
    }
    if (LOG.isInfoEnabled()) {
      LOG.info("run: #vertices: " + graph.getNumVertices() + " #edges: " +
          graph.getNumEdges());
    }

    graph.transformVertices(PageRankVertexProgram.INIT);
    SynchronousScheduler<PageRankState, Double> scheduler;
    try {
      scheduler = new SynchronousScheduler<PageRankState, Double>(gasConf,
          graph, new PageRankVertexProgram());
    } catch (IllegalArgumentException e) {
      LOG.error("run: Invalid configuration: " + e.getMessage());
      return -1;
    }
    scheduler.signalAll();
    lastSummary = scheduler.start();
    lastRankSum = graph.mapReduceVertices(PageRankVertexProgram.EXTRACT_RANK,
        PageRankVertexProgram.SUM, 0.0);
    if (LOG.isInfoEnabled()) {
      LOG.info("run: Finished Running engine in " +
          lastSummary.getElapsedSeconds() + " seconds after " +
          lastSummary.getNumRounds() + " rounds (" +
          lastSummary.getTerminationReason() + ")");
      LOG.info("run: Total updates: " + lastSummary.getNumUpdates());
      LOG.info("run: Update rate (updates/second): " +
          lastSummary.getUpdatesPerSecond());
      LOG.info("run: Sum of graph: " + lastRankSum);
    }

    if (cmd.hasOption("sp")) {
      try {
        List<Path> files = new PageRankTextVertexWriter(gasConf)
            .save(graph, cmd.getOptionValue("sp"));
        if (LOG.isInfoEnabled()) {
          LOG.info("run: Saved ranks to " + files);
        }
      } catch (IOException e) {
        LOG.error("run: Failed to save the ranks", e);
        return -1;
      }
    }
    return 0;
  }

  /**
   * Copy the command line into the configuration.
   *
   * @param gasConf Configuration
   * @param cmd Parsed command line
   */
  private static void populateConfiguration(GasConfiguration gasConf,
      CommandLine cmd) {
    if (cmd.hasOption("f")) {
      gasConf.setGraphFormat(GraphFormat.valueOf(
          cmd.getOptionValue("f").trim().toUpperCase()));
    }
    if (cmd.hasOption("pl")) {
      GasConfiguration.POWERLAW_VERTICES.set(gasConf,
          Integer.parseInt(cmd.getOptionValue("pl")));
    }
    if (cmd.hasOption("rp")) {
      PageRankSettings.RESET_PROB.set(gasConf,
          Double.parseDouble(cmd.getOptionValue("rp")));
    }
    if (cmd.hasOption("ct")) {
      PageRankSettings.CONVERGENCE_THRESHOLD.set(gasConf,
          Double.parseDouble(cmd.getOptionValue("ct")));
    }
    ConfigurationUtils.populateConfiguration(gasConf, cmd);
  }

  /**
   * Load the graph from files or generate it.
   *
   * @param gasConf Configuration
   * @param cmd Parsed command line
   * @return Finalized graph
   * @throws IOException on read failure or malformed input
   */
  private static InMemoryGraphStore<PageRankState> loadGraph(
      GasConfiguration gasConf, CommandLine cmd) throws IOException {
    GraphBuilder<PageRankState> builder = new GraphBuilder<PageRankState>(
        gasConf, new DefaultVertexValueFactory<PageRankState>(
            PageRankState.class));
    if (cmd.hasOption("g")) {
      new GraphLoader(gasConf).load(cmd.getOptionValue("g"), builder);
    } else {
      new PowerLawGraphGenerator(gasConf).generate(
          GasConfiguration.POWERLAW_VERTICES.get(gasConf), builder);
    }
    return builder.build();
  }

  /**
   * Execute PageRankRunner.
   *
   * @param args Typically command line arguments.
   * @throws Exception Any exceptions thrown.
   */
  public static void main(String[] args) throws Exception {
    System.exit(ToolRunner.run(new PageRankRunner(), args));
  }
}
