package com.verlumen.islandgp.config;

import com.google.common.flogger.FluentLogger;
import com.verlumen.islandgp.population.Individual;
import java.util.Optional;

/** Default reporter: logs the current champion. */
public final class LoggingProgressReporter implements ProgressReporter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static LoggingProgressReporter create() {
    return new LoggingProgressReporter();
  }

  private LoggingProgressReporter() {}

  @Override
  public void report(Optional<Individual> best, boolean cycleBoundary) {
    if (best.isEmpty()) {
      logger.atFine().log("No individual scored yet");
      return;
    }
    Individual champion = best.get();
    if (cycleBoundary) {
      logger.atInfo().log(
          "Cycle champion: fitness=%s tree=%s", champion.fitness().getAsDouble(), champion.tree());
    } else {
      logger.atFine().log(
          "Island champion: fitness=%s tree=%s", champion.fitness().getAsDouble(), champion.tree());
    }
  }
}
