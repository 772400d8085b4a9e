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
 * Extracts a value from a vertex, used with
 * {@link GraphStore#mapReduceVertices}.
 *
 * @param <V> Vertex value
 * @param <T> Extracted type
 */
public interface VertexMapper<V extends Writable, T> {
  /**
   * Extract a value from the vertex.
   *
   * @param vertex Vertex
   * @return Extracted value
   */
  T map(Vertex<V> vertex);
}
