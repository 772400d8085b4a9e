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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.hadoop.io.Writable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

/**
 * {@link GraphStore} keeping the topology in compressed sparse row form,
 * one offset/adjacency array pair per direction. Vertices are numbered in
 * ascending id order. Built by {@link GraphBuilder}.
 *
 * @param <V> Vertex value
 */
public class InMemoryGraphStore<V extends Writable> implements GraphStore<V> {
  /** Vertex ids by index */
  private final long[] ids;
  /** Id to index, -1 for unknown ids */
  private final Long2IntOpenHashMap idToIndex;
  /** Start of each vertex's out-edges in {@link #outTargets} */
  private final int[] outOffsets;
  /** Target indices of out-edges */
  private final int[] outTargets;
  /** Start of each vertex's in-edges in {@link #inSources} */
  private final int[] inOffsets;
  /** Source indices of in-edges */
  private final int[] inSources;
  /** Vertex views by index */
  private final DefaultVertex<V>[] vertices;

  /**
   * Constructor
   *
   * @param ids Sorted vertex ids
   * @param idToIndex Id to index map
   * @param outOffsets Out-edge offsets, length numVertices + 1
   * @param outTargets Out-edge targets
   * @param inOffsets In-edge offsets, length numVertices + 1
   * @param inSources In-edge sources
   * @param values Initial values by index
   */
  @SuppressWarnings("unchecked")
  InMemoryGraphStore(long[] ids, Long2IntOpenHashMap idToIndex,
      int[] outOffsets, int[] outTargets, int[] inOffsets, int[] inSources,
      List<V> values) {
    Preconditions.checkArgument(outOffsets.length == ids.length + 1 &&
        inOffsets.length == ids.length + 1, "InMemoryGraphStore: " +
        "Offsets must have one entry more than the vertices");
    Preconditions.checkArgument(outTargets.length == inSources.length,
        "InMemoryGraphStore: In and out adjacency sizes differ");
    this.ids = ids;
    this.idToIndex = idToIndex;
    this.idToIndex.defaultReturnValue(-1);
    this.outOffsets = outOffsets;
    this.outTargets = outTargets;
    this.inOffsets = inOffsets;
    this.inSources = inSources;
    vertices = new DefaultVertex[ids.length];
    for (int i = 0; i < ids.length; ++i) {
      vertices[i] = new DefaultVertex<V>(this, ids[i], i, values.get(i));
    }
  }

  @Override
  public int getNumVertices() {
    return ids.length;
  }

  @Override
  public long getNumEdges() {
    return outTargets.length;
  }

  @Override
  public boolean hasVertex(long id) {
    return idToIndex.containsKey(id);
  }

  @Override
  public Vertex<V> getVertex(long id) {
    int index = idToIndex.get(id);
    return index < 0 ? null : vertices[index];
  }

  @Override
  public Vertex<V> getVertexAt(int index) {
    return vertices[index];
  }

  @Override
  public int indexOf(long id) {
    return idToIndex.get(id);
  }

  /**
   * Out-degree of the vertex at an index.
   *
   * @param index Vertex index
   * @return Number of out-edges
   */
  int getNumOutEdges(int index) {
    return outOffsets[index + 1] - outOffsets[index];
  }

  /**
   * In-degree of the vertex at an index.
   *
   * @param index Vertex index
   * @return Number of in-edges
   */
  int getNumInEdges(int index) {
    return inOffsets[index + 1] - inOffsets[index];
  }

  @Override
  public Iterable<Edge<V>> getEdges(final Vertex<V> vertex,
      final EdgeDirection direction) {
    final int index = vertex.getIndex();
    Preconditions.checkArgument(index >= 0 && index < vertices.length &&
        vertices[index] == vertex,
        "getEdges: Vertex %s does not belong to this graph", vertex.getId());
    return new Iterable<Edge<V>>() {
      @Override
      public Iterator<Edge<V>> iterator() {
        Iterator<Edge<V>> in = direction.includesIn() ?
            new InEdgeIterator(index) : Collections.<Edge<V>>emptyIterator();
        Iterator<Edge<V>> out = direction.includesOut() ?
            new OutEdgeIterator(index) : Collections.<Edge<V>>emptyIterator();
        return Iterators.concat(in, out);
      }
    };
  }

  @Override
  public void transformVertices(VertexTransform<V> transform) {
    for (DefaultVertex<V> vertex : vertices) {
      transform.transform(vertex);
    }
  }

  @Override
  public <T> T mapReduceVertices(VertexMapper<V, T> mapper,
      ReduceOperation<T> reducer, T identity) {
    T result = identity;
    for (DefaultVertex<V> vertex : vertices) {
      result = reducer.reduce(result, mapper.map(vertex));
    }
    return result;
  }

  @Override
  public Iterator<Vertex<V>> iterator() {
    return new Iterator<Vertex<V>>() {
      /** Next index */
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < vertices.length;
      }

      @Override
      public Vertex<V> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return vertices[next++];
      }

      @Override
      public void remove() {
        throw new UnsupportedOperationException("remove: Graph is immutable");
      }
    };
  }

  /**
   * Iterates over the out-edges of one vertex.
   */
  private class OutEdgeIterator implements Iterator<Edge<V>> {
    /** Source vertex */
    private final DefaultVertex<V> source;
    /** Current position in {@link #outTargets} */
    private int position;
    /** End position, exclusive */
    private final int end;

    /**
     * Constructor
     *
     * @param index Source index
     */
    OutEdgeIterator(int index) {
      source = vertices[index];
      position = outOffsets[index];
      end = outOffsets[index + 1];
    }

    @Override
    public boolean hasNext() {
      return position < end;
    }

    @Override
    public Edge<V> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return new DefaultEdge<V>(source, vertices[outTargets[position++]]);
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException("remove: Graph is immutable");
    }
  }

  /**
   * Iterates over the in-edges of one vertex.
   */
  private class InEdgeIterator implements Iterator<Edge<V>> {
    /** Target vertex */
    private final DefaultVertex<V> target;
    /** Current position in {@link #inSources} */
    private int position;
    /** End position, exclusive */
    private final int end;

    /**
     * Constructor
     *
     * @param index Target index
     */
    InEdgeIterator(int index) {
      target = vertices[index];
      position = inOffsets[index];
      end = inOffsets[index + 1];
    }

    @Override
    public boolean hasNext() {
      return position < end;
    }

    @Override
    public Edge<V> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return new DefaultEdge<V>(vertices[inSources[position++]], target);
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException("remove: Graph is immutable");
    }
  }
}
