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
package exm.idg.common;

import java.io.IOException;
import java.util.HashSet;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.exceptions.InvalidOptionException;
import exm.idg.common.util.Pair;

public class Logging {
  private static final String IDG_LOGGER_NAME = "exm.idg";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  private static final HashSet<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getIDGLogger() {
    return Logger.getLogger(IDG_LOGGER_NAME);
  }

  /**
   * Set up logging from the {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE} settings
   * @return the graph logger
   * @throws InvalidOptionException if a setting is malformed
   */
  public static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }

  /**
   * Direct graph logging to a file.
   * @param logfile if null or empty, logging configuration is left alone
   * @param trace if true, log everything including individual unions
   * @return the graph logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger idgLogger = getIDGLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return idgLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      idgLogger.addAppender(appender);
    } catch (IOException e) {
      throw new IDGRuntimeError("Could not open log file " + logfile +
                                ": " + e.getMessage());
    }
    idgLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return idgLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getIDGLogger().warn(msg);
    } else {
      Logging.getIDGLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
