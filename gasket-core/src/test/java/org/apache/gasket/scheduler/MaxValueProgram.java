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
package org.apache.gasket.scheduler;

import java.util.concurrent.atomic.AtomicIntegerArray;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.Edge;
import org.apache.gasket.graph.EdgeDirection;
import org.apache.gasket.graph.Vertex;
import org.apache.gasket.program.AbstractVertexProgram;
import org.apache.gasket.program.RoundContext;
import org.apache.hadoop.io.LongWritable;

/**
 * Propagates the largest value along out-edges. A vertex scatters to its
 * out-neighbors when its value grew.
 */
public class MaxValueProgram
    extends AbstractVertexProgram<LongWritable, Long> {
  /** Did the last apply raise the value, by vertex index */
  private AtomicIntegerArray changed;
  /** Number of vertices, set by the test */
  private final int numVertices;

  /**
   * Constructor
   *
   * @param numVertices Number of vertices of the graph
   */
  public MaxValueProgram(int numVertices) {
    this.numVertices = numVertices;
  }

  @Override
  public void initialize(GasConfiguration conf) {
    super.initialize(conf);
    changed = new AtomicIntegerArray(numVertices);
  }

  @Override
  public Long gather(RoundContext context, Vertex<LongWritable> vertex,
      Edge<LongWritable> edge) {
    return edge.getSource().getValue().get();
  }

  @Override
  public Long combine(Long left, Long right) {
    return Math.max(left, right);
  }

  @Override
  public Long gatherIdentity() {
    return Long.MIN_VALUE;
  }

  @Override
  public void apply(RoundContext context, Vertex<LongWritable> vertex,
      Long total) {
    boolean grew = total > vertex.getValue().get();
    if (grew) {
      vertex.setValue(new LongWritable(total));
    }
    changed.set(vertex.getIndex(), grew ? 1 : 0);
  }

  @Override
  public EdgeDirection getScatterEdges(RoundContext context,
      Vertex<LongWritable> vertex) {
    return changed.get(vertex.getIndex()) == 1 ?
        EdgeDirection.OUT_EDGES : EdgeDirection.NO_EDGES;
  }

  @Override
  public boolean scatter(RoundContext context, Vertex<LongWritable> vertex,
      Edge<LongWritable> edge) {
    return true;
  }
}
