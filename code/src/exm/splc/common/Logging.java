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
package exm.splc.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.splc.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String SPL_LOGGER_NAME = "exm.splc";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  public static Logger getSPLLogger() {
    return Logger.getLogger(SPL_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger from the log file and trace settings
   * @throws InvalidOptionException
   */
  public static Logger setupLogging() throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Configure the compiler logger.  With a log file everything from DEBUG
   * (or TRACE) goes to the file, otherwise only warnings and errors go to
   * stderr.
   * @param logfile path of log file, empty or null for none
   * @param trace enable TRACE level
   * @return the configured logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                        throws InvalidOptionException {
    Logger splLogger = getSPLLogger();
    splLogger.removeAllAppenders();
    splLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (logfile != null && logfile.length() > 0) {
      FileAppender appender;
      try {
        appender = new FileAppender(layout, logfile, false);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \"" +
                                         logfile + "\": " + e.getMessage());
      }
      splLogger.addAppender(appender);
      splLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender appender = new ConsoleAppender(layout,
                                            ConsoleAppender.SYSTEM_ERR);
      splLogger.addAppender(appender);
      splLogger.setLevel(Level.WARN);
    }
    return splLogger;
  }
}
