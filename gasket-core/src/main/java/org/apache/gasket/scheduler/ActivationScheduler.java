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
package org.apache.gasket.scheduler;

import org.apache.hadoop.io.Writable;

/**
 * Runs a vertex program over a graph, round by round, until no vertex is
 * active.
 *
 * @param <V> Vertex value
 */
public interface ActivationScheduler<V extends Writable> {
  /**
   * Activate a vertex for the first round. Signaling an active vertex again
   * has no effect.
   *
   * @param id Vertex id
   */
  void signal(long id);

  /** Activate every vertex for the first round */
  void signalAll();

  /**
   * Register an observer of finished rounds.
   *
   * @param observer Observer
   */
  void addRoundObserver(RoundObserver observer);

  /**
   * Run to termination. May only be called once.
   *
   * @return Summary of the run
   */
  RunSummary start();

  /**
   * Number of apply invocations so far.
   *
   * @return Update count
   */
  long getNumUpdates();

  /**
   * Seconds elapsed in {@link #start()} so far.
   *
   * @return Elapsed seconds
   */
  double getElapsedSeconds();
}
