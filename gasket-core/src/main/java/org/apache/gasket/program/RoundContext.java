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
package org.apache.gasket.program;

import org.apache.gasket.conf.GasConfiguration;

/**
 * What a vertex program can see of the run while it is being called.
 */
public interface RoundContext {
  /**
   * Current round, starting at 1.
   *
   * @return Round number
   */
  int getRound();

  /**
   * Get the total (all workers) number of vertices.
   *
   * @return Total number of vertices in the graph
   */
  long getTotalNumVertices();

  /**
   * Get the configuration of the run.
   *
   * @return Configuration
   */
  GasConfiguration getConf();
}
