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
package spwn.common;

import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import spwn.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String SPWN_LOGGER_NAME = "spwn";

  private static final String FILE_LAYOUT = "%-5p %c{1} %m%n";

  private static final String FILE_APPENDER_NAME = "spwn-logfile";

  public static Logger getSPWNLogger() {
    return Logger.getLogger(SPWN_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.  Console output comes from
   * log4j.properties; this adds an optional log file.
   * @param logfile path of log file, empty or null for none
   * @param trace if true, log everything at TRACE level to the file
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException {
    Logger logger = getSPWNLogger();
    if (StringUtils.isNotBlank(logfile)) {
      try {
        FileAppender appender = new FileAppender(
            new PatternLayout(FILE_LAYOUT), logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        // Replace log file from any earlier setup
        Appender previous = logger.getAppender(FILE_APPENDER_NAME);
        if (previous != null) {
          logger.removeAppender(previous);
          previous.close();
        }
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      logger.setLevel(Level.TRACE);
    }
    return logger;
  }
}
