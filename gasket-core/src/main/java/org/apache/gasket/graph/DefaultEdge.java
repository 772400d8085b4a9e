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
 * A complete edge, the source and target vertices.
 *
 * @param <V> Vertex value
 */
public class DefaultEdge<V extends Writable> implements Edge<V> {
  /** Source vertex */
  private final Vertex<V> source;
  /** Target vertex */
  private final Vertex<V> target;

  /**
   * Constructor
   *
   * @param source Source vertex
   * @param target Target vertex
   */
  public DefaultEdge(Vertex<V> source, Vertex<V> target) {
    this.source = source;
    this.target = target;
  }

  @Override
  public Vertex<V> getSource() {
    return source;
  }

  @Override
  public Vertex<V> getTarget() {
    return target;
  }

  @Override
  public String toString() {
    return "(" + source.getId() + " -> " + target.getId() + ")";
  }
}
