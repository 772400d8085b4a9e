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
package org.apache.gasket.graph;

import java.io.IOException;

/**
 * Thrown when the graph topology or its input is not well formed, for
 * example an edge referencing a vertex that does not exist.
 */
public class MalformedGraphException extends IOException {
  /** Serialization version */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor
   *
   * @param message Description of the problem
   */
  public MalformedGraphException(String message) {
    super(message);
  }

  /**
   * Constructor
   *
   * @param message Description of the problem
   * @param cause Underlying cause
   */
  public MalformedGraphException(String message, Throwable cause) {
    super(message, cause);
  }
}
