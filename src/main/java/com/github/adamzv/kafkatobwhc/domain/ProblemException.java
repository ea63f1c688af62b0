package com.github.adamzv.kafkatobwhc.domain;

public class ProblemException extends RuntimeException {

  private final Problem problem;

  public ProblemException(Problem problem) {
    this(problem, null);
  }

  public ProblemException(Problem problem, Throwable cause) {
    super(problem != null ? problem.message() : null, cause);
    this.problem = problem;
  }

  public Problem problem() {
    return problem;
  }
}
