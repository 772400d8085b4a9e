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

import org.apache.gasket.graph.GraphBuilder;
import org.apache.gasket.graph.MalformedGraphException;

/**
 * Parses one line of a text graph file into vertices and edges.
 */
public interface GraphLineParser {
  /**
   * Parse a line and add what it describes to the builder. Blank lines and
   * comments add nothing.
   *
   * @param line Line without terminator
   * @param builder Graph builder
   * @throws MalformedGraphException if the line cannot be parsed
   */
  void parseLine(String line, GraphBuilder<?> builder)
    throws MalformedGraphException;
}
