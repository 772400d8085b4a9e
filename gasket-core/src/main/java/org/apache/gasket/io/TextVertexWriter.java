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
package org.apache.gasket.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.GraphStore;
import org.apache.gasket.graph.Vertex;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Writable;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Writes one text line per vertex, edges are never written. Output is
 * split into files named prefix_i_of_n (i from 1), each holding a
 * contiguous block of vertices in index order.
 *
 * @param <V> Vertex value
 */
public abstract class TextVertexWriter<V extends Writable> {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(TextVertexWriter.class);

  /** Configuration */
  private final GasConfiguration conf;

  /**
   * Constructor
   *
   * @param conf Configuration
   */
  public TextVertexWriter(GasConfiguration conf) {
    this.conf = conf;
  }

  public GasConfiguration getConf() {
    return conf;
  }

  /**
   * Convert a vertex to a line of text, without the line terminator.
   *
   * @param vertex Vertex
   * @return Line
   * @throws IOException on conversion failure
   */
  protected abstract String convertVertexToLine(Vertex<V> vertex)
    throws IOException;

  /**
   * Name of one output file.
   *
   * @param prefix Output prefix
   * @param file File number, from 1
   * @param numFiles Number of files
   * @return File name
   */
  public static String getFileName(String prefix, int file, int numFiles) {
    return prefix + "_" + file + "_of_" + numFiles;
  }

  /**
   * Write all vertices of a graph.
   *
   * @param graph Graph
   * @param prefix Output prefix
   * @return Files written
   * @throws IOException on write failure
   */
  public List<Path> save(GraphStore<V> graph, String prefix)
    throws IOException {
    int numFiles = GasConfiguration.OUTPUT_NUM_FILES.get(conf);
    Preconditions.checkArgument(numFiles >= 1,
        "save: %s must be at least 1, got %s",
        GasConfiguration.OUTPUT_NUM_FILES.getKey(), numFiles);
    List<Path> files = Lists.newArrayListWithCapacity(numFiles);
    int numVertices = graph.getNumVertices();
    for (int file = 0; file < numFiles; ++file) {
      int start = (int) ((long) numVertices * file / numFiles);
      int end = (int) ((long) numVertices * (file + 1) / numFiles);
      Path path = new Path(getFileName(prefix, file + 1, numFiles));
      FileSystem fs = path.getFileSystem(conf);
      try (Writer writer = new BufferedWriter(new OutputStreamWriter(
          fs.create(path, true), StandardCharsets.UTF_8))) {
        for (int index = start; index < end; ++index) {
          writer.write(convertVertexToLine(graph.getVertexAt(index)));
          writer.write('\n');
        }
      }
      files.add(path);
    }
    if (LOG.isInfoEnabled()) {
      LOG.info("save: Wrote " + numVertices + " vertices to " + numFiles +
          " files with prefix " + prefix);
    }
    return files;
  }
}
