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
package org.apache.gasket.examples;

import java.io.IOException;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.Vertex;
import org.apache.gasket.io.TextVertexWriter;

/**
 * Writes "id&lt;delimiter&gt;rank" per vertex.
 */
public class PageRankTextVertexWriter extends TextVertexWriter<PageRankState> {
  /** Saved delimiter */
  private final String delimiter;

  /**
   * Constructor
   *
   * @param conf Configuration
   */
  public PageRankTextVertexWriter(GasConfiguration conf) {
    super(conf);
    delimiter = GasConfiguration.OUTPUT_DELIMITER.get(conf);
  }

  @Override
  protected String convertVertexToLine(Vertex<PageRankState> vertex)
    throws IOException {
    return vertex.getId() + delimiter + vertex.getValue().getRank();
  }
}
