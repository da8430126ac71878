/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fjc.common;

import java.io.IOException;
import java.util.HashSet;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging {
  private static final String FJC_LOGGER_NAME = "exm.fjc";

  /**
   * Messages already emitted.
   */
  private static final HashSet<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getFJCLogger() {
    return Logger.getLogger(FJC_LOGGER_NAME);
  }

  /**
   * Send compiler log output to a file.  Console output is configured
   * separately through log4j.properties.
   * @param logfile file to write to, or null/empty for no file log
   * @param trace if true, log everything at TRACE level
   * @return the compiler logger
   */
  public static synchronized Logger setupLogging(String logfile,
                                                 boolean trace) {
    Logger fjcLogger = getFJCLogger();
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout("%-5p %m%n");
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        fjcLogger.addAppender(appender);
        fjcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
      } catch (IOException e) {
        fjcLogger.warn("Could not open log file " + logfile + ": " +
                       e.getMessage());
      }
    } else if (trace) {
      fjcLogger.setLevel(Level.TRACE);
    }
    return fjcLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.of(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getFJCLogger().warn(msg);
    } else {
      Logging.getFJCLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
