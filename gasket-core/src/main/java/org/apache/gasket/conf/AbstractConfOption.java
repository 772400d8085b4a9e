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

import java.util.Locale;

import org.apache.hadoop.conf.Configuration;

/**
 * A typed configuration option. Values are stored as strings in a Hadoop
 * {@link Configuration} and parsed on every lookup; an unset key yields the
 * default value.
 *
 * @param <T> Value type
 */
public abstract class AbstractConfOption<T> {
  /** Key for configuration */
  private final String key;
  /** Value when the key is not set */
  private final T defaultValue;
  /** Configuration option description */
  private final String description;

  /**
   * Constructor
   *
   * @param key configuration key
   * @param defaultValue default value
   * @param description configuration description
   */
  public AbstractConfOption(String key, T defaultValue, String description) {
    this.key = key;
    this.defaultValue = defaultValue;
    this.description = description;
  }

  /**
   * Create an option over an enum. Names are matched ignoring case and
   * surrounding blanks, so "snap" selects SNAP.
   *
   * @param key configuration key
   * @param klass enum class
   * @param defaultValue default value
   * @param description configuration description
   * @param <E> enum type
   * @return Option
   */
  public static <E extends Enum<E>> AbstractConfOption<E> forEnum(
      String key, final Class<E> klass, E defaultValue, String description) {
    return new AbstractConfOption<E>(key, defaultValue, description) {
      @Override
      protected E parse(String value) {
        return Enum.valueOf(klass, value.trim().toUpperCase(Locale.ROOT));
      }

      @Override
      protected String format(E value) {
        return value.name();
      }
    };
  }

  public String getKey() {
    return key;
  }

  /**
   * Lookup value
   *
   * @param conf Configuration
   * @return value for key, or default value if not set
   * @throws IllegalArgumentException if the stored value does not parse
   */
  public T get(Configuration conf) {
    String value = conf.get(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return parse(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("get: Invalid value '" + value +
          "' for " + key + " (" + description + ")", e);
    }
  }

  /**
   * Set value
   *
   * @param conf Configuration
   * @param value to set
   */
  public void set(Configuration conf, T value) {
    conf.set(key, format(value));
  }

  /**
   * Convert a stored string into a value.
   *
   * @param value Stored string, never null
   * @return Parsed value
   */
  protected abstract T parse(String value);

  /**
   * Convert a value into the string to store.
   *
   * @param value Value
   * @return String form that {@link #parse(String)} accepts
   */
  protected String format(T value) {
    return String.valueOf(value);
  }
}
