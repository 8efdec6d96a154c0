package com.verlumen.islandgp.config;

import com.verlumen.islandgp.population.Individual;
import java.util.Optional;

/**
 * Receives progress reports during a run. Generation reports come from island worker threads and
 * may arrive concurrently, so implementations must be thread safe. An exception thrown here aborts
 * the run.
 */
@FunctionalInterface
public interface ProgressReporter {
  /**
   * @param best the best individual known to the reporting island or coordinator, absent before
   *     the first generation has been scored
   * @param cycleBoundary true when reported by the coordinator between cycles, false for
   *     generation progress within an island
   */
  void report(Optional<Individual> best, boolean cycleBoundary);
}
