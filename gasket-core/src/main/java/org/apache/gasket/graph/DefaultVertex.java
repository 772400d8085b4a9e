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

import com.google.common.base.MoreObjects;

/**
 * Vertex of an {@link InMemoryGraphStore}. Degrees are answered by the store
 * from its adjacency offsets.
 *
 * @param <V> Vertex value
 */
public class DefaultVertex<V extends Writable> implements Vertex<V> {
  /** Owning store */
  private final InMemoryGraphStore<V> store;
  /** Vertex id */
  private final long id;
  /** Dense index */
  private final int index;
  /** Vertex value */
  private V value;

  /**
   * Constructor
   *
   * @param store Owning store
   * @param id Vertex id
   * @param index Dense index
   * @param value Initial value
   */
  DefaultVertex(InMemoryGraphStore<V> store, long id, int index, V value) {
    this.store = store;
    this.id = id;
    this.index = index;
    this.value = value;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public int getIndex() {
    return index;
  }

  @Override
  public V getValue() {
    return value;
  }

  @Override
  public void setValue(V value) {
    this.value = value;
  }

  @Override
  public int getNumOutEdges() {
    return store.getNumOutEdges(index);
  }

  @Override
  public int getNumInEdges() {
    return store.getNumInEdges(index);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("value", value)
        .toString();
  }
}
