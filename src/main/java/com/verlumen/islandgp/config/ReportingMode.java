package com.verlumen.islandgp.config;

/** Decides, from the number of remaining steps and the report rate, whether to report. */
public enum ReportingMode {
  /** Reports whenever the remaining step count is not a multiple of the report rate. */
  NONZERO_REMAINDER {
    @Override
    public boolean shouldReport(int remainingSteps, int reportRate) {
      return remainingSteps % reportRate != 0;
    }
  },

  /** Reports whenever the remaining step count is a multiple of the report rate. */
  EVERY_NTH {
    @Override
    public boolean shouldReport(int remainingSteps, int reportRate) {
      return remainingSteps % reportRate == 0;
    }
  };

  public abstract boolean shouldReport(int remainingSteps, int reportRate);
}
