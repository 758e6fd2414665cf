// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import java.util.Optional;
import java.util.logging.*;

/// Console logging for a node. The level comes from `LOG_LEVEL` and every line carries the peer's display name so
/// the output of several peers on one host can be told apart.
public class LoggerConfig {
  private static volatile String peerName = "";

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      ConsoleHandler consoleHandler = new ConsoleHandler() {{
        setOutputStream(System.out);
      }};

      final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
          .orElse("INFO");
      Level level = Level.parse(levelString);

      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          final var thrown = record.getThrown() == null ? "" : " " + record.getThrown();
          return String.format("[%s] %s%s%s%n",
              record.getLevel().getName(),
              peerName.isEmpty() ? "" : "[" + peerName + "] ",
              formatMessage(record),
              thrown);
        }
      });

    } catch (Exception e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  public static void initialize(String displayName) {
    peerName = displayName == null ? "" : displayName;
  }
}
