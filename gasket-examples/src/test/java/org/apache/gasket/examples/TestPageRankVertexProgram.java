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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.DefaultVertexValueFactory;
import org.apache.gasket.graph.Edge;
import org.apache.gasket.graph.EdgeDirection;
import org.apache.gasket.graph.GraphBuilder;
import org.apache.gasket.graph.InMemoryGraphStore;
import org.apache.gasket.graph.MalformedGraphException;
import org.apache.gasket.graph.Vertex;
import org.apache.gasket.graph.VertexTransform;
import org.apache.gasket.io.PowerLawGraphGenerator;
import org.apache.gasket.scheduler.RoundObserver;
import org.apache.gasket.scheduler.RoundStats;
import org.apache.gasket.scheduler.RunSummary;
import org.apache.gasket.scheduler.SynchronousScheduler;
import org.apache.gasket.scheduler.TerminationReason;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

public class TestPageRankVertexProgram {
  private GasConfiguration conf;

  @Before
  public void setUp() {
    conf = new GasConfiguration();
    conf.setNumComputeThreads(2);
  }

  /**
   * Builder for PageRank graphs.
   *
   * @return Builder
   */
  private GraphBuilder<PageRankState> newBuilder() {
    return new GraphBuilder<PageRankState>(conf,
        new DefaultVertexValueFactory<PageRankState>(PageRankState.class));
  }

  /**
   * Initialized graph from (source, target) pairs.
   *
   * @param edges Flattened source, target pairs
   * @return Graph with every rank at 1
   * @throws MalformedGraphException never
   */
  private InMemoryGraphStore<PageRankState> createGraph(long... edges)
    throws MalformedGraphException {
    GraphBuilder<PageRankState> builder = newBuilder();
    for (int i = 0; i < edges.length; i += 2) {
      builder.addEdge(edges[i], edges[i + 1]);
    }
    InMemoryGraphStore<PageRankState> graph = builder.build();
    graph.transformVertices(PageRankVertexProgram.INIT);
    return graph;
  }

  /**
   * Scheduler with every vertex signaled.
   *
   * @param graph Graph
   * @return Scheduler
   */
  private SynchronousScheduler<PageRankState, Double> createScheduler(
      InMemoryGraphStore<PageRankState> graph) {
    SynchronousScheduler<PageRankState, Double> scheduler =
        new SynchronousScheduler<PageRankState, Double>(conf, graph,
            new PageRankVertexProgram());
    scheduler.signalAll();
    return scheduler;
  }

  /**
   * Sum of all ranks.
   *
   * @param graph Graph
   * @return Rank sum
   */
  private static double rankSum(InMemoryGraphStore<PageRankState> graph) {
    return graph.mapReduceVertices(PageRankVertexProgram.EXTRACT_RANK,
        PageRankVertexProgram.SUM, 0.0);
  }

  @Test
  public void testCycleIsAlreadyConverged() throws MalformedGraphException {
    InMemoryGraphStore<PageRankState> graph =
        createGraph(1, 2, 2, 3, 3, 4, 4, 1);
    RunSummary summary = createScheduler(graph).start();
    assertEquals(1, summary.getNumRounds());
    assertEquals(4, summary.getNumUpdates());
    assertEquals(TerminationReason.CONVERGED,
        summary.getTerminationReason());
    for (Vertex<PageRankState> vertex : graph) {
      assertEquals(1.0, vertex.getValue().getRank(), 1e-12);
      assertEquals(0.0, vertex.getValue().getLastChange(), 1e-12);
    }
    assertEquals(4.0, rankSum(graph), 1e-9);
  }

  @Test
  public void testTriangleActivatesNothing() throws MalformedGraphException {
    InMemoryGraphStore<PageRankState> graph = createGraph(1, 2, 2, 3, 3, 1);
    SynchronousScheduler<PageRankState, Double> scheduler =
        createScheduler(graph);
    RoundObserver observer = mock(RoundObserver.class);
    scheduler.addRoundObserver(observer);
    scheduler.start();

    ArgumentCaptor<RoundStats> captor =
        ArgumentCaptor.forClass(RoundStats.class);
    verify(observer, times(1)).postRound(captor.capture());
    assertEquals(3, captor.getValue().getNumActiveVertices());
    assertEquals(0, captor.getValue().getNumActivationRequests());
    assertEquals(0, captor.getValue().getNumNextActiveVertices());
    assertEquals(3.0, rankSum(graph), 1e-9);
  }

  @Test
  public void testRankSumIsConservedWhileRanksMove()
    throws MalformedGraphException {
    InMemoryGraphStore<PageRankState> graph =
        createGraph(1, 2, 1, 3, 2, 3, 3, 1);
    RunSummary summary = createScheduler(graph).start();
    assertEquals(TerminationReason.CONVERGED,
        summary.getTerminationReason());
    assertTrue(summary.getNumRounds() > 1);
    // Fixed point of r1 = 0.15 + 0.85 r3, r2 = 0.15 + 0.85 r1 / 2,
    // r3 = 0.15 + 0.85 (r1 / 2 + r2)
    double r1 = 0.385875 / (1 - 0.6683125);
    double r2 = 0.15 + 0.425 * r1;
    double r3 = 0.15 + 0.85 * (r1 / 2 + r2);
    assertEquals(r1, graph.getVertex(1).getValue().getRank(), 0.01);
    assertEquals(r2, graph.getVertex(2).getValue().getRank(), 0.01);
    assertEquals(r3, graph.getVertex(3).getValue().getRank(), 0.01);
    assertEquals(3.0, rankSum(graph), 1e-6);
  }

  @Test
  public void testGatherReadsStartOfRoundRanks()
    throws MalformedGraphException {
    conf.setMaxRounds(1);
    InMemoryGraphStore<PageRankState> graph = createGraph(1, 2, 2, 1);
    graph.getVertex(2).getValue().setRank(3.0);
    createScheduler(graph).start();
    assertEquals(0.85 * 3.0 + 0.15, graph.getVertex(1).getValue().getRank(),
        1e-12);
    assertEquals(0.85 * 1.0 + 0.15, graph.getVertex(2).getValue().getRank(),
        1e-12);
    assertEquals(0.85 * 2.0, graph.getVertex(1).getValue().getLastChange(),
        1e-12);
  }

  @Test
  public void testRepeatedActivationIsMerged() throws MalformedGraphException {
    InMemoryGraphStore<PageRankState> graph = createGraph(1, 3, 2, 3);
    SynchronousScheduler<PageRankState, Double> scheduler =
        createScheduler(graph);
    RoundObserver observer = mock(RoundObserver.class);
    scheduler.addRoundObserver(observer);
    RunSummary summary = scheduler.start();

    ArgumentCaptor<RoundStats> captor =
        ArgumentCaptor.forClass(RoundStats.class);
    verify(observer, times(2)).postRound(captor.capture());
    List<RoundStats> stats = captor.getAllValues();
    assertEquals(2, stats.get(0).getNumActivationRequests());
    assertEquals(1, stats.get(0).getNumNextActiveVertices());
    assertEquals(1, stats.get(1).getNumActiveVertices());
    assertEquals(4, summary.getNumUpdates());
    assertEquals(0.15 + 2 * 0.85 * 0.15,
        graph.getVertex(3).getValue().getRank(), 1e-12);
  }

  @Test
  public void testDanglingVertexContributesNothing()
    throws MalformedGraphException {
    GraphBuilder<PageRankState> builder = newBuilder();
    builder.addEdge(1, 2).addVertex(3);
    InMemoryGraphStore<PageRankState> graph = builder.build();
    graph.transformVertices(PageRankVertexProgram.INIT);
    RunSummary summary = createScheduler(graph).start();
    assertEquals(2, summary.getNumRounds());
    assertEquals(0.15, graph.getVertex(1).getValue().getRank(), 1e-12);
    assertEquals(0.85 * 0.15 + 0.15, graph.getVertex(2).getValue().getRank(),
        1e-12);
    assertEquals(0.15, graph.getVertex(3).getValue().getRank(), 1e-12);
    assertEquals(0.15 + 0.85 * 0.15 + 0.15 + 0.15, rankSum(graph), 1e-12);
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testGatherGuardsZeroOutDegree() {
    PageRankVertexProgram program = new PageRankVertexProgram();
    program.initialize(conf);
    Vertex<PageRankState> source = mock(Vertex.class);
    when(source.getNumOutEdges()).thenReturn(0);
    when(source.getValue()).thenReturn(new PageRankState(5.0, 0));
    Edge<PageRankState> edge = mock(Edge.class);
    when(edge.getSource()).thenReturn(source);
    assertEquals(0.0, program.gather(null, null, edge), 0);

    when(source.getNumOutEdges()).thenReturn(2);
    assertEquals(0.85 / 2 * 5.0, program.gather(null, null, edge), 1e-12);
  }

  @Test
  public void testThresholdIsStrict() {
    conf.setDouble(PageRankSettings.CONVERGENCE_THRESHOLD.getKey(), 0.5);
    PageRankVertexProgram program = new PageRankVertexProgram();
    program.initialize(conf);
    @SuppressWarnings("unchecked")
    Vertex<PageRankState> vertex = mock(Vertex.class);
    when(vertex.getValue()).thenReturn(new PageRankState(1.0, 0.5));
    assertEquals(EdgeDirection.NO_EDGES,
        program.getScatterEdges(null, vertex));
    when(vertex.getValue()).thenReturn(new PageRankState(1.0, 0.5000001));
    assertEquals(EdgeDirection.OUT_EDGES,
        program.getScatterEdges(null, vertex));
  }

  @Test
  public void testConvergesOnPowerLawGraph() throws MalformedGraphException {
    GraphBuilder<PageRankState> builder = newBuilder();
    new PowerLawGraphGenerator(2.1, Integer.MAX_VALUE, 11).generate(
        1000, builder);
    InMemoryGraphStore<PageRankState> graph = builder.build();
    graph.transformVertices(PageRankVertexProgram.INIT);
    RunSummary summary = createScheduler(graph).start();
    assertEquals(TerminationReason.CONVERGED,
        summary.getTerminationReason());
    assertTrue(summary.getNumRounds() < 100);
    assertTrue(summary.getNumUpdates() >= 1000);
    for (Vertex<PageRankState> vertex : graph) {
      assertTrue(vertex.getValue().getRank() >= 0.15);
      assertTrue(vertex.getNumOutEdges() > 0);
    }
    assertEquals(1000.0, rankSum(graph), 20.0);
  }

  @Test
  public void testSameRanksForAnyThreadCount() throws MalformedGraphException {
    double[] single = runPowerLaw(1, 1);
    double[] parallel = runPowerLaw(8, 37);
    assertEquals(single.length, parallel.length);
    for (int i = 0; i < single.length; ++i) {
      assertEquals(Double.doubleToLongBits(single[i]),
          Double.doubleToLongBits(parallel[i]));
    }
  }

  /**
   * Run PageRank on a fixed generated graph.
   *
   * @param numThreads Compute threads
   * @param numPartitions Chunks per round
   * @return Ranks by index
   * @throws MalformedGraphException never
   */
  private double[] runPowerLaw(int numThreads, int numPartitions)
    throws MalformedGraphException {
    conf.setNumComputeThreads(numThreads);
    conf.setNumPartitions(numPartitions);
    GraphBuilder<PageRankState> builder = newBuilder();
    new PowerLawGraphGenerator(2.1, Integer.MAX_VALUE, 3).generate(
        500, builder);
    InMemoryGraphStore<PageRankState> graph = builder.build();
    graph.transformVertices(PageRankVertexProgram.INIT);
    createScheduler(graph).start();
    double[] ranks = new double[graph.getNumVertices()];
    for (Vertex<PageRankState> vertex : graph) {
      ranks[vertex.getIndex()] = vertex.getValue().getRank();
    }
    return ranks;
  }

  @Test
  public void testInvalidSettingsFailBeforeFirstRound()
    throws MalformedGraphException {
    InMemoryGraphStore<PageRankState> graph = createGraph(1, 2);
    final double[][] invalid = {{1.5, 0.01}, {0, 0.01}, {0.15, 0}};
    for (double[] settings : invalid) {
      PageRankSettings.RESET_PROB.set(conf, settings[0]);
      PageRankSettings.CONVERGENCE_THRESHOLD.set(conf, settings[1]);
      try {
        new SynchronousScheduler<PageRankState, Double>(conf, graph,
            new PageRankVertexProgram());
        fail("Settings " + settings[0] + ", " + settings[1] +
            " should be rejected");
      } catch (IllegalArgumentException e) {
        assertTrue(e.getMessage().contains("gasket.pagerank"));
      }
    }
    graph.transformVertices(new VertexTransform<PageRankState>() {
      @Override
      public void transform(Vertex<PageRankState> vertex) {
        assertEquals(1.0, vertex.getValue().getRank(), 0);
      }
    });
  }
}
