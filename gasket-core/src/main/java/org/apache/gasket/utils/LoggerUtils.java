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
package org.apache.gasket.utils;

import org.apache.gasket.conf.GasConfiguration;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * Logger utils for log4j
 */
public class LoggerUtils {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(LoggerUtils.class);
  /** Name of the logger all Gasket classes log under */
  private static final String GASKET_LOGGER = "org.apache.gasket";

  /**
   * Don't construct this.
   */
  private LoggerUtils() { }

  /**
   * Set the level of the Gasket loggers from the configuration.
   *
   * @param conf Configuration
   * @return Level now in effect
   */
  public static Level setLogLevel(GasConfiguration conf) {
    Logger logger = Logger.getLogger(GASKET_LOGGER);
    Level level = Level.toLevel(conf.getLogLevel(), Level.INFO);
    if (!level.equals(logger.getLevel())) {
      logger.setLevel(level);
      if (LOG.isInfoEnabled()) {
        LOG.info("setLogLevel: Set log level to " + level);
      }
    }
    return level;
  }
}
