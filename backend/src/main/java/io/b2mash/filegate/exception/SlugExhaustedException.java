package io.b2mash.filegate.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when random slug generation keeps colliding. Transient: the caller may retry the whole
 * request. Results in HTTP 503.
 */
public class SlugExhaustedException extends ErrorResponseException {

  public SlugExhaustedException(int attempts) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(attempts), null);
  }

  private static ProblemDetail createProblem(int attempts) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Slug generation exhausted");
    problem.setDetail(
        "Could not generate a unique link suffix after " + attempts + " attempts, please retry");
    problem.setProperty("retryable", true);
    return problem;
  }
}
