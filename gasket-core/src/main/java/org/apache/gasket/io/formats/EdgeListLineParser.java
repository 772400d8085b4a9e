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
 * Edge list: each line consists of source_vertex, target_vertex.
 * Anything after the second token is ignored.
 */
public class EdgeListLineParser implements GraphLineParser {
  /** Splitter for SNAP files, any whitespace */
  public static final Pattern WHITESPACE = Pattern.compile("\\s+");
  /** Splitter for tsv files */
  public static final Pattern TAB_OR_SPACE = Pattern.compile("[\t ]");

  /** Splitter for endpoints */
  private final Pattern separator;
  /** Prefix of comment lines, null if comments are not allowed */
  private final String commentPrefix;

  /**
   * Constructor
   *
   * @param separator Splitter for endpoints
   * @param commentPrefix Prefix of comment lines, or null
   */
  public EdgeListLineParser(Pattern separator, String commentPrefix) {
    this.separator = separator;
    this.commentPrefix = commentPrefix;
  }

  /**
   * Parser for SNAP edge lists.
   *
   * @return Parser
   */
  public static EdgeListLineParser snap() {
    return new EdgeListLineParser(WHITESPACE, "#");
  }

  /**
   * Parser for tab separated edge lists.
   *
   * @return Parser
   */
  public static EdgeListLineParser tsv() {
    return new EdgeListLineParser(TAB_OR_SPACE, null);
  }

  @Override
  public void parseLine(String line, GraphBuilder<?> builder)
    throws MalformedGraphException {
    String trimmed = line.trim();
    if (trimmed.isEmpty() ||
        (commentPrefix != null && trimmed.startsWith(commentPrefix))) {
      return;
    }
    String[] tokens = separator.split(trimmed);
    if (tokens.length < 2) {
      throw new MalformedGraphException(
          "parseLine: Expected source and target in '" + line + "'");
    }
    builder.addEdge(LineParsers.parseVertexId(tokens[0]),
        LineParsers.parseVertexId(tokens[1]));
  }
}
