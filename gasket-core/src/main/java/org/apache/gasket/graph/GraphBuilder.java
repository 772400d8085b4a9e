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

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.util.Arrays;
import java.util.List;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.hadoop.io.Writable;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Accumulates vertices and edges, then finalizes them into an
 * {@link InMemoryGraphStore}. Duplicate edges and self-loops are kept.
 * A builder can be finalized only once.
 *
 * @param <V> Vertex value
 */
public class GraphBuilder<V extends Writable> {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(GraphBuilder.class);

  /** Creates values for vertices added without one */
  private final VertexValueFactory<V> valueFactory;
  /** Create vertices only referenced by edges */
  private final boolean createMissingVertices;
  /** Explicitly added vertex ids */
  private final LongOpenHashSet vertexIds = new LongOpenHashSet();
  /** Explicitly given values */
  private final Long2ObjectOpenHashMap<V> values =
      new Long2ObjectOpenHashMap<V>();
  /** Edge sources, in insertion order */
  private final LongArrayList edgeSources = new LongArrayList();
  /** Edge targets, in insertion order */
  private final LongArrayList edgeTargets = new LongArrayList();
  /** Has {@link #build()} been called? */
  private boolean built = false;

  /**
   * Constructor
   *
   * @param conf Configuration
   * @param valueFactory Creates values for vertices added without one
   */
  public GraphBuilder(GasConfiguration conf,
      VertexValueFactory<V> valueFactory) {
    this.valueFactory = valueFactory;
    this.createMissingVertices = conf.createMissingVertices();
  }

  /**
   * Add a vertex with a default value. Adding an existing id is a no-op.
   *
   * @param id Vertex id
   * @return this
   */
  public GraphBuilder<V> addVertex(long id) {
    checkNotBuilt();
    vertexIds.add(id);
    return this;
  }

  /**
   * Add a vertex with a value, replacing any value given before.
   *
   * @param id Vertex id
   * @param value Initial value
   * @return this
   */
  public GraphBuilder<V> addVertex(long id, V value) {
    checkNotBuilt();
    vertexIds.add(id);
    values.put(id, value);
    return this;
  }

  /**
   * Add a directed edge.
   *
   * @param sourceId Source vertex id
   * @param targetId Target vertex id
   * @return this
   */
  public GraphBuilder<V> addEdge(long sourceId, long targetId) {
    checkNotBuilt();
    Preconditions.checkState(edgeSources.size() < Integer.MAX_VALUE - 8,
        "addEdge: Too many edges");
    edgeSources.add(sourceId);
    edgeTargets.add(targetId);
    return this;
  }

  public int getNumVerticesAdded() {
    return vertexIds.size();
  }

  public int getNumEdgesAdded() {
    return edgeSources.size();
  }

  /**
   * Finalize the graph. Topology is frozen afterwards.
   *
   * @return Graph store
   * @throws MalformedGraphException if an edge references a vertex that was
   *         never added and missing vertices are not created
   */
  public InMemoryGraphStore<V> build() throws MalformedGraphException {
    checkNotBuilt();
    built = true;
    int numEdges = edgeSources.size();
    for (int i = 0; i < numEdges; ++i) {
      resolveEndpoint(edgeSources.getLong(i), i);
      resolveEndpoint(edgeTargets.getLong(i), i);
    }

    long[] ids = vertexIds.toLongArray();
    Arrays.sort(ids);
    Long2IntOpenHashMap idToIndex = new Long2IntOpenHashMap(ids.length);
    idToIndex.defaultReturnValue(-1);
    for (int i = 0; i < ids.length; ++i) {
      idToIndex.put(ids[i], i);
    }

    int[] sources = new int[numEdges];
    int[] targets = new int[numEdges];
    for (int i = 0; i < numEdges; ++i) {
      sources[i] = idToIndex.get(edgeSources.getLong(i));
      targets[i] = idToIndex.get(edgeTargets.getLong(i));
    }
    int[] outOffsets = new int[ids.length + 1];
    int[] outTargets = new int[numEdges];
    groupBy(sources, targets, outOffsets, outTargets);
    int[] inOffsets = new int[ids.length + 1];
    int[] inSources = new int[numEdges];
    groupBy(targets, sources, inOffsets, inSources);

    List<V> vertexValues = Lists.newArrayListWithCapacity(ids.length);
    for (long id : ids) {
      V value = values.get(id);
      vertexValues.add(value == null ? valueFactory.newInstance() : value);
    }

    if (LOG.isInfoEnabled()) {
      LOG.info("build: Finalized graph with " + ids.length + " vertices and " +
          numEdges + " edges");
    }
    return new InMemoryGraphStore<V>(ids, idToIndex, outOffsets, outTargets,
        inOffsets, inSources, vertexValues);
  }

  /**
   * Make sure an edge endpoint is a vertex.
   *
   * @param id Endpoint id
   * @param edge Edge position, for the error message
   * @throws MalformedGraphException if missing and not created
   */
  private void resolveEndpoint(long id, int edge)
    throws MalformedGraphException {
    if (vertexIds.contains(id)) {
      return;
    }
    if (!createMissingVertices) {
      throw new MalformedGraphException("build: Edge " +
          edgeSources.getLong(edge) + " -> " + edgeTargets.getLong(edge) +
          " references vertex " + id + " which was never added");
    }
    vertexIds.add(id);
  }

  /**
   * Stable counting sort of edges by key index into offset/adjacency form.
   *
   * @param keys Grouping endpoint index per edge
   * @param others Other endpoint index per edge
   * @param offsets Output offsets, length numVertices + 1
   * @param adjacency Output adjacency, length numEdges
   */
  private static void groupBy(int[] keys, int[] others, int[] offsets,
      int[] adjacency) {
    for (int key : keys) {
      offsets[key + 1]++;
    }
    for (int i = 1; i < offsets.length; ++i) {
      offsets[i] += offsets[i - 1];
    }
    int[] cursor = Arrays.copyOf(offsets, offsets.length - 1);
    for (int i = 0; i < keys.length; ++i) {
      adjacency[cursor[keys[i]]++] = others[i];
    }
  }

  /** Fail if the graph was already finalized */
  private void checkNotBuilt() {
    Preconditions.checkState(!built,
        "GraphBuilder: Graph was already finalized");
  }
}
