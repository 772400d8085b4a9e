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

/**
 * Which edges of a vertex a gather or scatter phase visits.
 */
public enum EdgeDirection {
  /** No edges */
  NO_EDGES,
  /** Edges whose target is the vertex */
  IN_EDGES,
  /** Edges whose source is the vertex */
  OUT_EDGES,
  /** Both in and out edges */
  ALL_EDGES;

  /**
   * Does this direction visit in-edges?
   *
   * @return true for IN_EDGES and ALL_EDGES
   */
  public boolean includesIn() {
    return this == IN_EDGES || this == ALL_EDGES;
  }

  /**
   * Does this direction visit out-edges?
   *
   * @return true for OUT_EDGES and ALL_EDGES
   */
  public boolean includesOut() {
    return this == OUT_EDGES || this == ALL_EDGES;
  }
}
