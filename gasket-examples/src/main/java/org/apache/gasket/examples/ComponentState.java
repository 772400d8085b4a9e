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

/**
 * Component label of a vertex and whether the last apply lowered it.
 */
public class ComponentState implements Writable {
  /** Smallest vertex id seen */
  private long component;
  /** Did the last apply change the label? */
  private boolean changed;

  public long getComponent() {
    return component;
  }

  public void setComponent(long component) {
    this.component = component;
  }

  public boolean isChanged() {
    return changed;
  }

  public void setChanged(boolean changed) {
    this.changed = changed;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeLong(component);
    out.writeBoolean(changed);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    component = in.readLong();
    changed = in.readBoolean();
  }

  @Override
  public String toString() {
    return Long.toString(component);
  }
}
