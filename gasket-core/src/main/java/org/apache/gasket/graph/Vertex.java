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
package org.apache.gasket.graph;

import org.apache.hadoop.io.Writable;

/**
 * A vertex of a finalized graph. The topology is read-only; only the value
 * is mutable, and only by the vertex program's apply for this vertex (or by
 * a bulk transform before the first round).
 *
 * @param <V> Vertex value
 */
public interface Vertex<V extends Writable> {
  /**
   * Get the vertex id.
   *
   * @return My vertex id.
   */
  long getId();

  /**
   * Dense position of the vertex in its graph, in [0, numVertices).
   *
   * @return Vertex index
   */
  int getIndex();

  /**
   * Get the vertex value (data stored with vertex)
   *
   * @return Vertex value
   */
  V getValue();

  /**
   * Set the vertex data (immediately visible in the computation)
   *
   * @param value Vertex data to be set
   */
  void setValue(V value);

  /**
   * Get the number of outgoing edges on this vertex.
   *
   * @return the total number of outbound edges from this vertex
   */
  int getNumOutEdges();

  /**
   * Get the number of incoming edges on this vertex.
   *
   * @return the total number of inbound edges to this vertex
   */
  int getNumInEdges();
}
