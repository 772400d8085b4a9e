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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.hadoop.io.LongWritable;
import org.junit.Test;

import com.google.common.collect.Lists;

public class TestInMemoryGraphStore {
  /**
   * Collect "source->target" strings of the edges of a vertex.
   *
   * @param graph Graph
   * @param id Vertex id
   * @param direction Direction
   * @return Edge strings
   */
  private static List<String> edges(GraphStore<LongWritable> graph, long id,
      EdgeDirection direction) {
    List<String> result = Lists.newArrayList();
    for (Edge<LongWritable> edge :
        graph.getEdges(graph.getVertex(id), direction)) {
      result.add(edge.getSource().getId() + "->" + edge.getTarget().getId());
    }
    return result;
  }

  @Test
  public void testIndicesFollowIdOrder() throws MalformedGraphException {
    GasConfiguration conf = new GasConfiguration();
    InMemoryGraphStore<LongWritable> graph =
        GraphFixtures.longGraph(conf, 30, 10, 10, 20, 20, 30);
    assertEquals(3, graph.getNumVertices());
    assertEquals(3, graph.getNumEdges());
    assertEquals(0, graph.indexOf(10));
    assertEquals(1, graph.indexOf(20));
    assertEquals(2, graph.indexOf(30));
    assertEquals(-1, graph.indexOf(40));
    assertFalse(graph.hasVertex(40));
    assertNull(graph.getVertex(40));
    assertSame(graph.getVertex(20), graph.getVertexAt(1));

    long previous = Long.MIN_VALUE;
    int index = 0;
    for (Vertex<LongWritable> vertex : graph) {
      assertTrue(vertex.getId() > previous);
      assertEquals(index++, vertex.getIndex());
      previous = vertex.getId();
    }
    assertEquals(3, index);
  }

  @Test
  public void testDuplicatesAndSelfLoopsAreKept()
    throws MalformedGraphException {
    GasConfiguration conf = new GasConfiguration();
    InMemoryGraphStore<LongWritable> graph =
        GraphFixtures.longGraph(conf, 1, 2, 1, 2, 2, 2, 2, 1);
    assertEquals(4, graph.getNumEdges());
    Vertex<LongWritable> one = graph.getVertex(1);
    Vertex<LongWritable> two = graph.getVertex(2);
    assertEquals(2, one.getNumOutEdges());
    assertEquals(1, one.getNumInEdges());
    assertEquals(2, two.getNumOutEdges());
    assertEquals(3, two.getNumInEdges());

    assertEquals(Lists.newArrayList("1->2", "1->2"),
        edges(graph, 1, EdgeDirection.OUT_EDGES));
    assertEquals(Lists.newArrayList("1->2", "1->2", "2->2"),
        edges(graph, 2, EdgeDirection.IN_EDGES));
    assertEquals(Lists.newArrayList("1->2", "1->2", "2->2", "2->2", "2->1"),
        edges(graph, 2, EdgeDirection.ALL_EDGES));
    assertTrue(edges(graph, 2, EdgeDirection.NO_EDGES).isEmpty());
  }

  @Test
  public void testIsolatedVertex() throws MalformedGraphException {
    GasConfiguration conf = new GasConfiguration();
    GraphBuilder<LongWritable> builder = GraphFixtures.newLongBuilder(conf);
    builder.addVertex(7, new LongWritable(70)).addVertex(7).addEdge(1, 2);
    InMemoryGraphStore<LongWritable> graph = builder.build();
    assertEquals(3, graph.getNumVertices());
    Vertex<LongWritable> seven = graph.getVertex(7);
    assertEquals(70, seven.getValue().get());
    assertEquals(0, seven.getNumOutEdges());
    assertEquals(0, seven.getNumInEdges());
    assertTrue(edges(graph, 7, EdgeDirection.ALL_EDGES).isEmpty());
    assertEquals(0, graph.getVertex(1).getValue().get());
  }

  @Test
  public void testMissingVerticesRejected() {
    GasConfiguration conf = new GasConfiguration();
    conf.setCreateMissingVertices(false);
    GraphBuilder<LongWritable> builder = GraphFixtures.newLongBuilder(conf);
    builder.addVertex(1).addEdge(1, 2);
    try {
      builder.build();
      fail("Edge to a vertex that was never added should fail");
    } catch (MalformedGraphException e) {
      assertTrue(e.getMessage().contains("vertex 2"));
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testBuildOnce() throws MalformedGraphException {
    GraphBuilder<LongWritable> builder =
        GraphFixtures.newLongBuilder(new GasConfiguration());
    builder.addEdge(1, 2);
    builder.build();
    builder.addEdge(2, 3);
  }

  @Test
  public void testTransformAndMapReduce() throws MalformedGraphException {
    InMemoryGraphStore<LongWritable> graph = GraphFixtures.longGraph(
        new GasConfiguration(), 1, 2, 2, 3, 3, 4);
    graph.transformVertices(new VertexTransform<LongWritable>() {
      @Override
      public void transform(Vertex<LongWritable> vertex) {
        vertex.setValue(new LongWritable(vertex.getId() * 10));
      }
    });
    long sum = graph.mapReduceVertices(
        new VertexMapper<LongWritable, Long>() {
          @Override
          public Long map(Vertex<LongWritable> vertex) {
            return vertex.getValue().get();
          }
        },
        new ReduceOperation<Long>() {
          @Override
          public Long reduce(Long left, Long right) {
            return left + right;
          }
        }, 0L);
    assertEquals(100, sum);
  }

  @Test
  public void testEmptyGraph() throws MalformedGraphException {
    InMemoryGraphStore<LongWritable> graph =
        GraphFixtures.longGraph(new GasConfiguration());
    assertEquals(0, graph.getNumVertices());
    assertEquals(0, graph.getNumEdges());
    assertFalse(graph.iterator().hasNext());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForeignVertex() throws MalformedGraphException {
    GasConfiguration conf = new GasConfiguration();
    InMemoryGraphStore<LongWritable> graph =
        GraphFixtures.longGraph(conf, 1, 2);
    InMemoryGraphStore<LongWritable> other =
        GraphFixtures.longGraph(conf, 1, 2);
    graph.getEdges(other.getVertex(1), EdgeDirection.OUT_EDGES);
  }
}
