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

/**
 * Supported text graph formats.
 */
public enum GraphFormat {
  /**
   * SNAP edge list: one "source target" pair per line, whitespace
   * separated, lines starting with '#' are comments.
   */
  SNAP,
  /** Tab or space separated "source target" pairs, one per line */
  TSV,
  /**
   * Adjacency list: "source numTargets target1 ... targetN" per line.
   */
  ADJ
}
