package org.apache.lucene.packed.util;

/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link InfoStream} implementation which passes messages on to SLF4J.
 * Each component gets its own logger, named
 * <code>org.apache.lucene.packed.util.LoggingInfoStream.&lt;component&gt;</code>,
 * so components can be enabled individually in the logging configuration.
 * Messages are logged at DEBUG level.
 */
public class LoggingInfoStream extends InfoStream {

  private final String prefix;

  public LoggingInfoStream() {
    this(LoggingInfoStream.class.getName());
  }

  /** Uses <code>prefix + "." + component</code> as logger name. */
  public LoggingInfoStream(String prefix) {
    this.prefix = prefix;
  }

  @Override
  public void message(String component, String message) {
    final Logger logger = getLogger(component);
    if (logger.isDebugEnabled()) {
      logger.debug("[" + Thread.currentThread().getName() + "]: " + message);
    }
  }

  @Override
  public boolean isEnabled(String component) {
    return getLogger(component).isDebugEnabled();
  }

  @Override
  public void close() {
    // loggers are owned by the logging framework
  }

  private Logger getLogger(String component) {
    return LoggerFactory.getLogger(prefix + "." + component);
  }
}
