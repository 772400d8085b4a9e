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
package org.apache.gasket.io.formats;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.GraphBuilder;
import org.apache.gasket.graph.GraphFixtures;
import org.apache.gasket.graph.InMemoryGraphStore;
import org.apache.gasket.graph.MalformedGraphException;
import org.apache.hadoop.io.LongWritable;
import org.junit.Before;
import org.junit.Test;

public class TestLineParsers {
  private GraphBuilder<LongWritable> builder;

  @Before
  public void setUp() {
    builder = GraphFixtures.newLongBuilder(new GasConfiguration());
  }

  /**
   * Expect a line to be rejected.
   *
   * @param parser Parser
   * @param line Line
   */
  private void assertRejected(GraphLineParser parser, String line) {
    try {
      parser.parseLine(line, builder);
      fail("Should reject '" + line + "'");
    } catch (MalformedGraphException e) {
      // expected
    }
  }

  @Test
  public void testSnap() throws MalformedGraphException {
    GraphLineParser parser = EdgeListLineParser.snap();
    parser.parseLine("# Directed graph: example.txt", builder);
    parser.parseLine("   ", builder);
    parser.parseLine("1\t2", builder);
    parser.parseLine("2   3", builder);
    parser.parseLine("  3 1  ", builder);
    assertEquals(3, builder.getNumEdgesAdded());
    InMemoryGraphStore<LongWritable> graph = builder.build();
    assertEquals(3, graph.getNumVertices());
    assertEquals(1, graph.getVertex(3).getNumOutEdges());
  }

  @Test
  public void testTsv() throws MalformedGraphException {
    GraphLineParser parser = EdgeListLineParser.tsv();
    parser.parseLine("5\t6", builder);
    parser.parseLine("", builder);
    parser.parseLine("6 5", builder);
    assertEquals(2, builder.getNumEdgesAdded());
    assertRejected(parser, "# comment");
    assertRejected(parser, "7");
  }

  @Test
  public void testAdjacency() throws MalformedGraphException {
    GraphLineParser parser = new AdjacencyListLineParser();
    parser.parseLine("1 3 2 3 4", builder);
    parser.parseLine("9 0", builder);
    parser.parseLine("", builder);
    InMemoryGraphStore<LongWritable> graph = builder.build();
    assertEquals(5, graph.getNumVertices());
    assertEquals(3, graph.getVertex(1).getNumOutEdges());
    assertEquals(0, graph.getVertex(9).getNumOutEdges());
  }

  @Test
  public void testAdjacencyCountMismatch() {
    GraphLineParser parser = new AdjacencyListLineParser();
    assertRejected(parser, "1 3 2 3");
    assertRejected(parser, "1 1 2 3");
    assertRejected(parser, "1");
    assertRejected(parser, "1 x 2");
  }

  @Test
  public void testInvalidIds() {
    GraphLineParser parser = EdgeListLineParser.snap();
    assertRejected(parser, "a b");
    assertRejected(parser, "-1 2");
    assertRejected(parser, "1 2.5");
  }
}
