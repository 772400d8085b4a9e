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

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.graph.GraphBuilder;
import org.apache.gasket.graph.MalformedGraphException;
import org.apache.gasket.io.formats.AdjacencyListLineParser;
import org.apache.gasket.io.formats.EdgeListLineParser;
import org.apache.gasket.io.formats.GraphLineParser;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.PathFilter;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.CompressionCodecFactory;
import org.apache.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;

/**
 * Loads a text graph into a {@link GraphBuilder}. The input is a file, a
 * directory (every visible file in it) or a prefix (every file in the
 * parent directory whose name starts with it). Files are read through the
 * Hadoop {@link FileSystem} of the path and decompressed according to
 * their extension.
 */
public class GraphLoader {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(GraphLoader.class);
  /** Skips hidden and bookkeeping files */
  private static final PathFilter VISIBLE_FILES = new PathFilter() {
    @Override
    public boolean accept(Path path) {
      String name = path.getName();
      return !name.startsWith(".") && !name.startsWith("_");
    }
  };

  /** Configuration */
  private final GasConfiguration conf;
  /** Input format */
  private final GraphFormat format;

  /**
   * Constructor using the configured format.
   *
   * @param conf Configuration
   */
  public GraphLoader(GasConfiguration conf) {
    this(conf, conf.getGraphFormat());
  }

  /**
   * Constructor
   *
   * @param conf Configuration
   * @param format Input format
   */
  public GraphLoader(GasConfiguration conf, GraphFormat format) {
    this.conf = conf;
    this.format = format;
  }

  /**
   * Create the line parser of a format.
   *
   * @param format Graph format
   * @return Line parser
   */
  public static GraphLineParser createLineParser(GraphFormat format) {
    switch (format) {
    case SNAP:
      return EdgeListLineParser.snap();
    case TSV:
      return EdgeListLineParser.tsv();
    case ADJ:
      return new AdjacencyListLineParser();
    default:
      throw new IllegalArgumentException(
          "createLineParser: Unknown format " + format);
    }
  }

  /**
   * Load every input file of a path.
   *
   * @param graph File, directory or prefix
   * @param builder Graph builder
   * @return Number of files read
   * @throws IOException on read failure or malformed input
   */
  public int load(String graph, GraphBuilder<?> builder) throws IOException {
    Path path = new Path(graph);
    FileSystem fs = path.getFileSystem(conf);
    List<Path> files = listInputFiles(fs, path);
    GraphLineParser parser = createLineParser(format);
    CompressionCodecFactory codecs = new CompressionCodecFactory(conf);
    for (Path file : files) {
      loadFile(fs, file, codecs.getCodec(file), parser, builder);
    }
    if (LOG.isInfoEnabled()) {
      LOG.info("load: Read " + files.size() + " " + format + " files from " +
          graph + ", " + builder.getNumEdgesAdded() + " edges so far");
    }
    return files.size();
  }

  /**
   * Resolve the input files of a path.
   *
   * @param fs File system
   * @param path File, directory or prefix
   * @return Files, sorted by name
   * @throws IOException if nothing matches
   */
  static List<Path> listInputFiles(FileSystem fs, Path path)
    throws IOException {
    List<Path> files = Lists.newArrayList();
    if (fs.exists(path)) {
      FileStatus status = fs.getFileStatus(path);
      if (!status.isDirectory()) {
        files.add(path);
        return files;
      }
      addFiles(fs.listStatus(path, VISIBLE_FILES), files);
    } else if (path.getParent() != null && fs.exists(path.getParent())) {
      final String prefix = path.getName();
      addFiles(fs.listStatus(path.getParent(), new PathFilter() {
        @Override
        public boolean accept(Path candidate) {
          return candidate.getName().startsWith(prefix);
        }
      }), files);
    }
    if (files.isEmpty()) {
      throw new FileNotFoundException(
          "listInputFiles: No input files match " + path);
    }
    return files;
  }

  /**
   * Add the regular files among the statuses, in name order.
   *
   * @param statuses File statuses
   * @param files Output list
   */
  private static void addFiles(FileStatus[] statuses, List<Path> files) {
    Arrays.sort(statuses);
    for (FileStatus status : statuses) {
      if (!status.isDirectory()) {
        files.add(status.getPath());
      }
    }
  }

  /**
   * Parse one file.
   *
   * @param fs File system
   * @param file File
   * @param codec Compression codec, null for plain text
   * @param parser Line parser
   * @param builder Graph builder
   * @throws IOException on read failure or malformed input
   */
  @VisibleForTesting
  static void loadFile(FileSystem fs, Path file,
      CompressionCodec codec, GraphLineParser parser,
      GraphBuilder<?> builder) throws IOException {
    if (LOG.isDebugEnabled()) {
      LOG.debug("loadFile: Loading " + file +
          (codec == null ? "" : " with " + codec.getClass().getSimpleName()));
    }
    try (InputStream raw = fs.open(file);
        BufferedReader reader = new BufferedReader(new InputStreamReader(
            codec == null ? raw : codec.createInputStream(raw),
            StandardCharsets.UTF_8))) {
      String line;
      long lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        ++lineNumber;
        try {
          parser.parseLine(line, builder);
        } catch (MalformedGraphException e) {
          throw new MalformedGraphException("loadFile: " + file + ":" +
              lineNumber + ": " + e.getMessage(), e);
        }
      }
    }
  }
}
