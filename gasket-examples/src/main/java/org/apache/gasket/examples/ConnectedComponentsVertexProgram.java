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

import org.apache.gasket.graph.Edge;
import org.apache.gasket.graph.EdgeDirection;
import org.apache.gasket.graph.Vertex;
import org.apache.gasket.graph.VertexTransform;
import org.apache.gasket.program.AbstractVertexProgram;
import org.apache.gasket.program.RoundContext;

/**
 * Weakly connected components by minimum label propagation. Every vertex
 * starts with its own id as label and takes the smallest label among
 * itself and its neighbors in both directions. A vertex whose label
 * dropped activates the neighbors that still carry a larger one.
 */
public class ConnectedComponentsVertexProgram
    extends AbstractVertexProgram<ComponentState, Long> {
  /** Labels every vertex with its own id */
  public static final VertexTransform<ComponentState> INIT =
      new VertexTransform<ComponentState>() {
        @Override
        public void transform(Vertex<ComponentState> vertex) {
          ComponentState state = new ComponentState();
          state.setComponent(vertex.getId());
          vertex.setValue(state);
        }
      };

  @Override
  public EdgeDirection getGatherEdges(RoundContext context,
      Vertex<ComponentState> vertex) {
    return EdgeDirection.ALL_EDGES;
  }

  @Override
  public Long gather(RoundContext context, Vertex<ComponentState> vertex,
      Edge<ComponentState> edge) {
    return otherEnd(vertex, edge).getValue().getComponent();
  }

  @Override
  public Long combine(Long left, Long right) {
    return Math.min(left, right);
  }

  @Override
  public Long gatherIdentity() {
    return Long.MAX_VALUE;
  }

  @Override
  public void apply(RoundContext context, Vertex<ComponentState> vertex,
      Long total) {
    ComponentState state = vertex.getValue();
    boolean changed = total < state.getComponent();
    if (changed) {
      state.setComponent(total);
    }
    state.setChanged(changed);
  }

  @Override
  public EdgeDirection getScatterEdges(RoundContext context,
      Vertex<ComponentState> vertex) {
    return vertex.getValue().isChanged() ?
        EdgeDirection.ALL_EDGES : EdgeDirection.NO_EDGES;
  }

  @Override
  public boolean scatter(RoundContext context, Vertex<ComponentState> vertex,
      Edge<ComponentState> edge) {
    return otherEnd(vertex, edge).getValue().getComponent() >
        vertex.getValue().getComponent();
  }

  /**
   * The endpoint of an edge that is not the given vertex.
   *
   * @param vertex Vertex
   * @param edge Edge adjacent to the vertex
   * @return Far endpoint
   */
  private static Vertex<ComponentState> otherEnd(
      Vertex<ComponentState> vertex, Edge<ComponentState> edge) {
    return edge.getSource() == vertex ? edge.getTarget() : edge.getSource();
  }
}
