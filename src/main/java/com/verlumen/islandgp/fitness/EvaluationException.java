package com.verlumen.islandgp.fitness;

/** Raised when compiling or running a candidate program fails. */
public class EvaluationException extends RuntimeException {
  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
