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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.gasket.scheduler.TerminationReason;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.Lists;

public class TestPageRankRunner {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private PageRankRunner runner;

  @Before
  public void setUp() {
    runner = new PageRankRunner();
    runner.setConf(new GasConfiguration());
  }

  /**
   * Write a graph file.
   *
   * @param name File name
   * @param lines Lines
   * @return File
   * @throws IOException on write failure
   */
  private File writeGraph(String name, String... lines) throws IOException {
    File file = folder.newFile(name);
    Files.write(file.toPath(), Lists.newArrayList(lines),
        StandardCharsets.UTF_8);
    return file;
  }

  @Test
  public void testLoadRunAndSave() throws Exception {
    File graph = writeGraph("cycle.adj", "1 1 2", "2 1 3", "3 1 4", "4 1 1");
    String prefix = new File(folder.getRoot(), "ranks").getAbsolutePath();
    assertEquals(0, runner.run(new String[] {
        "--graph", graph.getAbsolutePath(), "--saveprefix", prefix,
        "--threads", "2"}));
    assertEquals(TerminationReason.CONVERGED,
        runner.getLastSummary().getTerminationReason());
    assertEquals(4.0, runner.getLastRankSum(), 1e-9);

    List<String> lines = Files.readAllLines(
        new File(prefix + "_1_of_1").toPath(), StandardCharsets.UTF_8);
    assertEquals(Lists.newArrayList("1\t1.0", "2\t1.0", "3\t1.0", "4\t1.0"),
        lines);
  }

  @Test
  public void testSnapFormatAndSettings() throws Exception {
    File graph = writeGraph("edges.txt", "# FromNodeId\tToNodeId", "1\t2",
        "2\t1", "3\t1");
    assertEquals(0, runner.run(new String[] {
        "-g", graph.getAbsolutePath(), "-f", "snap", "-rp", "0.5",
        "-ct", "0.001", "-ca", "gasket.numPartitions=2"}));
    assertEquals(TerminationReason.CONVERGED,
        runner.getLastSummary().getTerminationReason());
    assertTrue(runner.getLastSummary().getNumRounds() > 1);
  }

  @Test
  public void testPowerLaw() throws Exception {
    assertEquals(0, runner.run(new String[] {
        "--powerlaw", "300", "--maxRounds", "2"}));
    assertEquals(2, runner.getLastSummary().getNumRounds());
    assertEquals(TerminationReason.MAX_ROUNDS,
        runner.getLastSummary().getTerminationReason());
  }

  @Test
  public void testHelp() throws Exception {
    assertEquals(0, runner.run(new String[] {"--help"}));
    assertNull(runner.getLastSummary());
  }

  @Test
  public void testUsageErrors() throws Exception {
    assertEquals(-1, runner.run(new String[0]));
    assertEquals(-1, runner.run(new String[] {"--bogus"}));
    assertEquals(-1, runner.run(new String[] {
        "--graph", "a", "--powerlaw", "10"}));
    assertEquals(-1, runner.run(new String[] {
        "--powerlaw", "10", "--format", "metis"}));
    assertEquals(-1, runner.run(new String[] {
        "--powerlaw", "10", "--resetProb", "1.5"}));
    assertNull(runner.getLastSummary());
  }

  @Test
  public void testInputErrors() throws Exception {
    assertEquals(-1, runner.run(new String[] {
        "--graph", new File(folder.getRoot(), "none").getAbsolutePath()}));
    File bad = writeGraph("bad.adj", "1 2 3");
    assertEquals(-1, runner.run(new String[] {
        "--graph", bad.getAbsolutePath()}));
    assertNull(runner.getLastSummary());
  }
}
