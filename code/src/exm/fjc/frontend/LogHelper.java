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
package exm.fjc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.Logging;

/**
 * Helper functions to augment log messages with the current source
 * location and nesting depth.
 */
public class LogHelper {
  static final Logger logger = Logging.getFJCLogger();

  public static void debug(int indent, SourceLocation loc, String msg) {
    log(indent, Level.DEBUG, loc, msg);
  }

  public static void trace(int indent, SourceLocation loc, String msg) {
    log(indent, Level.TRACE, loc, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, null, msg);
  }

  public static void log(int indent, Level level, SourceLocation loc,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    if (loc != null) {
      sb.append(loc).append(": ");
    }
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static void uniqueWarn(SourceLocation loc, String msg) {
    Logging.uniqueWarn(loc + ": " + msg);
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
