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
import org.apache.gasket.graph.Edge;
import org.apache.gasket.graph.EdgeDirection;
import org.apache.gasket.graph.Vertex;
import org.apache.hadoop.io.Writable;

/**
 * A vertex-centric gather-apply-scatter program.
 *
 * Every round the scheduler calls, for each active vertex, {@link #gather}
 * once per edge returned by {@link #getGatherEdges}, folding the results
 * with {@link #combine} starting from {@link #gatherIdentity}. Once all
 * gathers of the round are done it calls {@link #apply} with the total, and
 * once all applies are done it calls {@link #scatter} once per edge
 * returned by {@link #getScatterEdges}. A scatter returning true activates
 * the far endpoint of the edge for the next round.
 *
 * Gather sees the state as of the start of the round. Apply may only
 * modify the vertex it was called for. {@link #combine} must be associative
 * and commutative.
 *
 * @param <V> Vertex value
 * @param <G> Gather result
 */
public interface VertexProgram<V extends Writable, G> {
  /**
   * Called once before the first round. Read and validate run constants
   * here; throw {@link IllegalArgumentException} on invalid settings.
   *
   * @param conf Configuration
   */
  void initialize(GasConfiguration conf);

  /**
   * Which edges to gather over.
   *
   * @param context Round context
   * @param vertex Vertex being gathered
   * @return Edge direction
   */
  EdgeDirection getGatherEdges(RoundContext context, Vertex<V> vertex);

  /**
   * Contribution of one edge.
   *
   * @param context Round context
   * @param vertex Vertex being gathered
   * @param edge Edge adjacent to the vertex
   * @return Contribution
   */
  G gather(RoundContext context, Vertex<V> vertex, Edge<V> edge);

  /**
   * Combine two contributions.
   *
   * @param left Left contribution
   * @param right Right contribution
   * @return Combined contribution
   */
  G combine(G left, G right);

  /**
   * Total of a vertex with no gathered edges.
   *
   * @return Identity of {@link #combine}
   */
  G gatherIdentity();

  /**
   * Update the vertex value from the gathered total.
   *
   * @param context Round context
   * @param vertex Vertex
   * @param total Combined contributions
   */
  void apply(RoundContext context, Vertex<V> vertex, G total);

  /**
   * Which edges to scatter over, after apply.
   *
   * @param context Round context
   * @param vertex Vertex
   * @return Edge direction, {@link EdgeDirection#NO_EDGES} when converged
   */
  EdgeDirection getScatterEdges(RoundContext context, Vertex<V> vertex);

  /**
   * Decide whether to activate the far endpoint of an edge: the target of
   * an out-edge, the source of an in-edge.
   *
   * @param context Round context
   * @param vertex Vertex scattering
   * @param edge Edge adjacent to the vertex
   * @return true to activate the far endpoint next round
   */
  boolean scatter(RoundContext context, Vertex<V> vertex, Edge<V> edge);
}
