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

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.Edge;
import org.apache.gasket.graph.EdgeDirection;
import org.apache.gasket.graph.ReduceOperation;
import org.apache.gasket.graph.Vertex;
import org.apache.gasket.graph.VertexMapper;
import org.apache.gasket.graph.VertexTransform;
import org.apache.gasket.program.AbstractVertexProgram;
import org.apache.gasket.program.RoundContext;

/**
 * PageRank with convergence-driven activation. Each vertex sums
 * (1 - resetProb) * rank / outDegree over its in-edges, adds resetProb, and
 * activates its out-neighbors only when its rank moved by more than the
 * convergence threshold. Ranks are not normalized: their sum approaches
 * the number of vertices on graphs without dangling vertices.
 */
public class PageRankVertexProgram
    extends AbstractVertexProgram<PageRankState, Double> {
  /** Sets every rank to 1 and the last change to 0 */
  public static final VertexTransform<PageRankState> INIT =
      new VertexTransform<PageRankState>() {
        @Override
        public void transform(Vertex<PageRankState> vertex) {
          vertex.setValue(new PageRankState(1.0, 0));
        }
      };
  /** Extracts the rank of a vertex */
  public static final VertexMapper<PageRankState, Double> EXTRACT_RANK =
      new VertexMapper<PageRankState, Double>() {
        @Override
        public Double map(Vertex<PageRankState> vertex) {
          return vertex.getValue().getRank();
        }
      };
  /** Sums doubles */
  public static final ReduceOperation<Double> SUM =
      new ReduceOperation<Double>() {
        @Override
        public Double reduce(Double left, Double right) {
          return left + right;
        }
      };

  /** Random reset probability */
  private double resetProb;
  /** Activation threshold */
  private double convergenceThreshold;

  @Override
  public void initialize(GasConfiguration conf) {
    super.initialize(conf);
    resetProb = PageRankSettings.getResetProb(conf);
    convergenceThreshold = PageRankSettings.getConvergenceThreshold(conf);
  }

  @Override
  public Double gather(RoundContext context, Vertex<PageRankState> vertex,
      Edge<PageRankState> edge) {
    Vertex<PageRankState> source = edge.getSource();
    int numOutEdges = source.getNumOutEdges();
    if (numOutEdges == 0) {
      return 0.0;
    }
    return ((1.0 - resetProb) / numOutEdges) * source.getValue().getRank();
  }

  @Override
  public Double combine(Double left, Double right) {
    return left + right;
  }

  @Override
  public Double gatherIdentity() {
    return 0.0;
  }

  @Override
  public void apply(RoundContext context, Vertex<PageRankState> vertex,
      Double total) {
    PageRankState state = vertex.getValue();
    double newRank = total + resetProb;
    state.setLastChange(Math.abs(newRank - state.getRank()));
    state.setRank(newRank);
  }

  @Override
  public EdgeDirection getScatterEdges(RoundContext context,
      Vertex<PageRankState> vertex) {
    return vertex.getValue().getLastChange() > convergenceThreshold ?
        EdgeDirection.OUT_EDGES : EdgeDirection.NO_EDGES;
  }

  @Override
  public boolean scatter(RoundContext context, Vertex<PageRankState> vertex,
      Edge<PageRankState> edge) {
    return true;
  }
}
