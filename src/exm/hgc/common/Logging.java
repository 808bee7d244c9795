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

package exm.hgc.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.hgc.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String HGC_LOGGER_NAME = "exm.hgc";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  public static Logger getHGCLogger()
  {
    return Logger.getLogger(HGC_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the compiler logger.
   * @param logfile if null or empty, leave whatever configuration
   *                log4j found on the classpath
   * @param trace log at trace level instead of debug
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                        throws InvalidOptionException
  {
    Logger hgcLogger = getHGCLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                          new PatternLayout(LOG_PATTERN), logfile, false);
        hgcLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
                                  + logfile + ": " + e.getMessage());
      }
      hgcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return hgcLogger;
  }
}
