package io.b2mash.filegate.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** An object-store call failed. Not retried here. Results in HTTP 502. */
public class UpstreamTransferException extends ErrorResponseException {

  public UpstreamTransferException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), cause);
  }

  public UpstreamTransferException(String detail) {
    this(detail, null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Storage transfer failed");
    problem.setDetail(detail);
    return problem;
  }
}
