package com.verlumen.islandgp.config;

/** Default values applied by {@link GpConfig#builder()} for settings the caller leaves out. */
final class GpDefaults {
  static final int DEPTH_MAX = 4;
  static final int DEPTH_MIN = 2;
  static final double MUTATION_RATE = 0.05;
  static final int REPORT_RATE = 1;
  static final int TERM_MAX = 1;
  static final int TERM_MIN = -1;
  static final int TOURNAMENT_SIZE = 5;

  private GpDefaults() {}
}
