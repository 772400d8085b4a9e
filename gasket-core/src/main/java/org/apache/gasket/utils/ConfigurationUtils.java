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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.gasket.conf.GasConfiguration;
import org.apache.log4j.Logger;

import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;

/**
 * Translates command line arguments into configuration key-value pairs.
 */
public class ConfigurationUtils {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(ConfigurationUtils.class);

  /** Do not instantiate. */
  private ConfigurationUtils() { }

  /**
   * Options understood by every Gasket runner. Runners add their own.
   *
   * @return New options
   */
  public static Options createOptions() {
    Options options = new Options();
    options.addOption("h", "help", false, "Help");
    options.addOption("t", "threads", true,
        "Number of compute threads (" +
        GasConfiguration.NUM_COMPUTE_THREADS.getKey() + ")");
    options.addOption("mr", "maxRounds", true,
        "Stop after this many rounds (" +
        GasConfiguration.MAX_ROUNDS.getKey() + ")");
    options.addOption("ms", "maxRunSeconds", true,
        "Stop after this many seconds (" +
        GasConfiguration.MAX_RUN_SECONDS.getKey() + ")");
    options.addOption("ca", "customArguments", true, "provide custom" +
        " arguments for the run configuration in the form:" +
        " -ca <param1>=<value1>,<param2>=<value2> -ca <param3>=<value3> etc." +
        " It can appear multiple times, and the last one has effect" +
        " for the same param.");
    return options;
  }

  /**
   * Copy the common options of a parsed command line into the
   * configuration. Custom arguments are applied last.
   *
   * @param conf Configuration
   * @param cmd Parsed command line
   */
  public static void populateConfiguration(GasConfiguration conf,
      CommandLine cmd) {
    if (cmd.hasOption("t")) {
      conf.setNumComputeThreads(Integer.parseInt(cmd.getOptionValue("t")));
    }
    if (cmd.hasOption("mr")) {
      conf.setMaxRounds(Integer.parseInt(cmd.getOptionValue("mr")));
    }
    if (cmd.hasOption("ms")) {
      conf.setMaxRunSeconds(Long.parseLong(cmd.getOptionValue("ms")));
    }
    if (cmd.hasOption("ca")) {
      for (String caOptionValue : cmd.getOptionValues("ca")) {
        for (String paramValue :
            Splitter.on(',').split(caOptionValue)) {
          String[] parts = Iterables.toArray(Splitter.on('=').split(paramValue),
                                              String.class);
          if (parts.length != 2) {
            throw new IllegalArgumentException("Unable to parse custom " +
                " argument: " + paramValue);
          }
          if (LOG.isInfoEnabled()) {
            LOG.info("Setting custom argument [" + parts[0] + "] to [" +
                parts[1] + "] in GasConfiguration");
          }
          conf.set(parts[0], parts[1]);
        }
      }
    }
  }

  /**
   * Print the usage of a runner.
   *
   * @param name Runner name
   * @param options Runner options
   */
  public static void printHelp(String name, Options options) {
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(name + " [options]", options);
  }
}
