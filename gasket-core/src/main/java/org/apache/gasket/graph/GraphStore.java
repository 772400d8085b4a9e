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
 * Finalized graph: a fixed set of vertices and directed edges with a mutable
 * value per vertex. Iteration visits vertices in dense index order.
 *
 * @param <V> Vertex value
 */
public interface GraphStore<V extends Writable> extends Iterable<Vertex<V>> {
  /**
   * Get the number of vertices.
   *
   * @return Number of vertices
   */
  int getNumVertices();

  /**
   * Get the number of edges, duplicates and self-loops included.
   *
   * @return Number of edges
   */
  long getNumEdges();

  /**
   * Does the graph contain a vertex with this id?
   *
   * @param id Vertex id
   * @return true if present
   */
  boolean hasVertex(long id);

  /**
   * Get the vertex with the given id.
   *
   * @param id Vertex id
   * @return Vertex, or null if absent
   */
  Vertex<V> getVertex(long id);

  /**
   * Get the vertex at a dense index.
   *
   * @param index Index in [0, numVertices)
   * @return Vertex
   */
  Vertex<V> getVertexAt(int index);

  /**
   * Dense index of a vertex id.
   *
   * @param id Vertex id
   * @return Index, or -1 if absent
   */
  int indexOf(long id);

  /**
   * Edges of a vertex in the given direction. In-edges are listed before
   * out-edges for {@link EdgeDirection#ALL_EDGES}; a self-loop therefore
   * appears once on each side.
   *
   * @param vertex Vertex
   * @param direction Which edges
   * @return Edges, in insertion order within each side
   */
  Iterable<Edge<V>> getEdges(Vertex<V> vertex, EdgeDirection direction);

  /**
   * Apply a transform to every vertex, in index order.
   *
   * @param transform Transform
   */
  void transformVertices(VertexTransform<V> transform);

  /**
   * Fold a per-vertex value over all vertices, in index order.
   *
   * @param mapper Extracts a value per vertex
   * @param reducer Associative combination
   * @param identity Result for an empty graph
   * @param <T> Value type
   * @return Combined value
   */
  <T> T mapReduceVertices(VertexMapper<V, T> mapper,
      ReduceOperation<T> reducer, T identity);
}
