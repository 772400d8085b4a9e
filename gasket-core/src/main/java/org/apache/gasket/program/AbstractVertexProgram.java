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
import org.apache.gasket.graph.EdgeDirection;
import org.apache.gasket.graph.Vertex;
import org.apache.hadoop.io.Writable;

/**
 * Base for vertex programs: gathers over in-edges and keeps the
 * configuration it was initialized with.
 *
 * @param <V> Vertex value
 * @param <G> Gather result
 */
public abstract class AbstractVertexProgram<V extends Writable, G>
    implements VertexProgram<V, G> {
  /** Configuration */
  private GasConfiguration conf;

  @Override
  public void initialize(GasConfiguration conf) {
    this.conf = conf;
  }

  public GasConfiguration getConf() {
    return conf;
  }

  @Override
  public EdgeDirection getGatherEdges(RoundContext context,
      Vertex<V> vertex) {
    return EdgeDirection.IN_EDGES;
  }
}
