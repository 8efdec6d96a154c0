package com.verlumen.islandgp.population;

import java.util.Optional;

/** Rules for keeping the best individual seen so far. */
public final class Champions {
  /**
   * Returns the incumbent unless the challenger is strictly fitter. With no incumbent the
   * challenger wins.
   */
  public static Individual keepBetter(Optional<Individual> incumbent, Individual challenger) {
    if (incumbent.isEmpty()) {
      return challenger;
    }
    return Individual.BY_FITNESS.compare(challenger, incumbent.get()) < 0
        ? challenger
        : incumbent.get();
  }

  /** Returns true if the champion exists and has reached zero error. */
  public static boolean isPerfect(Optional<Individual> champion) {
    return champion.isPresent() && champion.get().isPerfect();
  }

  private Champions() {}
}
