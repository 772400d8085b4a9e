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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

import org.apache.hadoop.io.Writable;

import com.google.common.base.MoreObjects;

/**
 * PageRank value of a vertex: the current rank and the magnitude of its
 * last update.
 */
public class PageRankState implements Writable {
  /** Current rank */
  private double rank;
  /** |new rank - old rank| of the last apply, 0 before the first */
  private double lastChange;

  /** Default constructor for reflection */
  public PageRankState() {
  }

  /**
   * Constructor
   *
   * @param rank Rank
   * @param lastChange Last change
   */
  public PageRankState(double rank, double lastChange) {
    this.rank = rank;
    this.lastChange = lastChange;
  }

  public double getRank() {
    return rank;
  }

  public void setRank(double rank) {
    this.rank = rank;
  }

  public double getLastChange() {
    return lastChange;
  }

  public void setLastChange(double lastChange) {
    this.lastChange = lastChange;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeDouble(rank);
    out.writeDouble(lastChange);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    rank = in.readDouble();
    lastChange = in.readDouble();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("rank", rank)
        .add("lastChange", lastChange)
        .toString();
  }
}
