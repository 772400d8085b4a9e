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

import java.util.BitSet;

import com.google.common.base.Preconditions;

/**
 * Set of vertex indices scheduled for a round. Activation is idempotent:
 * activating an index twice leaves a single entry. Not thread-safe; the
 * scheduler fills it from one thread after the scatter barrier.
 */
public class ActiveSet {
  /** Number of vertices in the graph */
  private final int numVertices;
  /** Active bits */
  private final BitSet bits;
  /** Number of set bits */
  private int size = 0;

  /**
   * Constructor
   *
   * @param numVertices Number of vertices in the graph
   */
  public ActiveSet(int numVertices) {
    Preconditions.checkArgument(numVertices >= 0,
        "ActiveSet: Negative number of vertices %s", numVertices);
    this.numVertices = numVertices;
    bits = new BitSet(numVertices);
  }

  /**
   * Activate a vertex.
   *
   * @param index Vertex index
   * @return true if the vertex was not active before
   */
  public boolean activate(int index) {
    Preconditions.checkElementIndex(index, numVertices, "activate: index");
    if (bits.get(index)) {
      return false;
    }
    bits.set(index);
    ++size;
    return true;
  }

  /** Activate every vertex */
  public void activateAll() {
    bits.set(0, numVertices);
    size = numVertices;
  }

  /**
   * Is the vertex active?
   *
   * @param index Vertex index
   * @return true if active
   */
  public boolean isActive(int index) {
    return bits.get(index);
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Active indices in ascending order.
   *
   * @return New array of indices
   */
  public int[] toArray() {
    int[] indices = new int[size];
    int position = 0;
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      indices[position++] = i;
    }
    return indices;
  }

  @Override
  public String toString() {
    return "(size=" + size + ",numVertices=" + numVertices + ")";
  }
}
