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

import java.util.regex.Pattern;

import org.apache.gasket.graph.GraphBuilder;
import org.apache.gasket.graph.MalformedGraphException;

/**
 * Adjacency list: each line consists of source_vertex, number of targets,
 * then that many target vertices. A vertex with no targets is still added.
 */
public class AdjacencyListLineParser implements GraphLineParser {
  /** Splitter for tokens */
  private static final Pattern SEPARATOR = Pattern.compile("\\s+");

  @Override
  public void parseLine(String line, GraphBuilder<?> builder)
    throws MalformedGraphException {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return;
    }
    String[] tokens = SEPARATOR.split(trimmed);
    if (tokens.length < 2) {
      throw new MalformedGraphException(
          "parseLine: Expected source and target count in '" + line + "'");
    }
    long source = LineParsers.parseVertexId(tokens[0]);
    int numTargets;
    try {
      numTargets = Integer.parseInt(tokens[1]);
    } catch (NumberFormatException e) {
      throw new MalformedGraphException(
          "parseLine: Invalid target count '" + tokens[1] + "'", e);
    }
    if (numTargets != tokens.length - 2) {
      throw new MalformedGraphException("parseLine: Vertex " + source +
          " declares " + numTargets + " targets but lists " +
          (tokens.length - 2));
    }
    builder.addVertex(source);
    for (int i = 2; i < tokens.length; ++i) {
      builder.addEdge(source, LineParsers.parseVertexId(tokens[i]));
    }
  }
}
