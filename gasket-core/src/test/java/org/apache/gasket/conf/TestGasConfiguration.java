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
package org.apache.gasket.conf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.gasket.io.GraphFormat;
import org.apache.hadoop.conf.Configuration;
import org.junit.Test;

public class TestGasConfiguration {
  @Test
  public void testDefaults() {
    GasConfiguration conf = new GasConfiguration();
    assertEquals(1, conf.getNumComputeThreads());
    assertEquals(16, conf.getNumPartitions());
    assertEquals(-1, conf.getMaxRounds());
    assertEquals(-1L, conf.getMaxRunSeconds());
    assertTrue(conf.createMissingVertices());
    assertEquals(GraphFormat.ADJ, conf.getGraphFormat());
    assertEquals("info", conf.getLogLevel());
    assertNull(conf.get(GasConstants.NUM_PARTITIONS.getKey()));
  }

  @Test
  public void testSetters() {
    GasConfiguration conf = new GasConfiguration();
    conf.setNumComputeThreads(8);
    conf.setNumPartitions(3);
    conf.setMaxRounds(10);
    conf.setMaxRunSeconds(60);
    conf.setCreateMissingVertices(false);
    conf.setGraphFormat(GraphFormat.SNAP);
    assertEquals(8, conf.getNumComputeThreads());
    assertEquals(3, conf.getNumPartitions());
    assertEquals(10, conf.getMaxRounds());
    assertEquals(60L, conf.getMaxRunSeconds());
    assertFalse(conf.createMissingVertices());
    assertEquals(GraphFormat.SNAP, conf.getGraphFormat());
    assertEquals("8", conf.get("gasket.numComputeThreads"));
    assertEquals("SNAP", conf.get("gasket.graph.format"));
  }

  @Test
  public void testCopiesHadoopConfiguration() {
    Configuration hadoopConf = new Configuration(false);
    hadoopConf.set("gasket.numComputeThreads", "4");
    GasConfiguration conf = new GasConfiguration(hadoopConf);
    assertEquals(4, conf.getNumComputeThreads());
  }

  @Test
  public void testEnumIsCaseInsensitive() {
    GasConfiguration conf = new GasConfiguration();
    conf.set(GasConstants.GRAPH_FORMAT.getKey(), " tsv ");
    assertEquals(GraphFormat.TSV, conf.getGraphFormat());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownEnumValue() {
    GasConfiguration conf = new GasConfiguration();
    conf.set(GasConstants.GRAPH_FORMAT.getKey(), "metis");
    conf.getGraphFormat();
  }

  @Test
  public void testTypedOptions() {
    GasConfiguration conf = new GasConfiguration();
    DoubleConfOption doubleOption =
        new DoubleConfOption("gasket.test.double", 0.5, "test");
    assertEquals(0.5, doubleOption.get(conf), 0);
    doubleOption.set(conf, 0.25);
    assertEquals(0.25, doubleOption.get(conf), 0);

    LongConfOption longOption =
        new LongConfOption("gasket.test.long", 3L, "test");
    conf.set(longOption.getKey(), " 12 ");
    assertEquals(Long.valueOf(12), longOption.get(conf));

    BooleanConfOption booleanOption =
        new BooleanConfOption("gasket.test.boolean", false, "test");
    conf.set(booleanOption.getKey(), "TRUE");
    assertTrue(booleanOption.get(conf));

    StrConfOption strOption =
        new StrConfOption("gasket.test.str", "\t", "test");
    assertEquals("\t", strOption.get(conf));
    strOption.set(conf, " ");
    assertEquals(" ", strOption.get(conf));
  }

  @Test
  public void testInvalidValueNamesKey() {
    GasConfiguration conf = new GasConfiguration();
    conf.set(GasConstants.NUM_COMPUTE_THREADS.getKey(), "many");
    try {
      conf.getNumComputeThreads();
      fail("Unparseable integer accepted");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("gasket.numComputeThreads"));
      assertTrue(e.getCause() instanceof NumberFormatException);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidBoolean() {
    GasConfiguration conf = new GasConfiguration();
    conf.set(GasConstants.CREATE_MISSING_VERTICES.getKey(), "yes");
    conf.createMissingVertices();
  }
}
