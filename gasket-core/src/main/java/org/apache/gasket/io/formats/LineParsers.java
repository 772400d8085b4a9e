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

import org.apache.gasket.graph.MalformedGraphException;

/**
 * Helpers shared by the line parsers.
 */
public class LineParsers {
  /** Do not instantiate */
  private LineParsers() { }

  /**
   * Parse a vertex id.
   *
   * @param token Token
   * @return Non-negative vertex id
   * @throws MalformedGraphException if the token is not a non-negative long
   */
  public static long parseVertexId(String token)
    throws MalformedGraphException {
    long id;
    try {
      id = Long.parseLong(token);
    } catch (NumberFormatException e) {
      throw new MalformedGraphException(
          "parseVertexId: Invalid vertex id '" + token + "'", e);
    }
    if (id < 0) {
      throw new MalformedGraphException(
          "parseVertexId: Negative vertex id " + id);
    }
    return id;
  }
}
