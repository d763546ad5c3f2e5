package io.b2mash.filegate.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an upload would push a storage config past its configured capacity. Results in HTTP
 * 400 with the remaining, requested and total byte counts as problem properties.
 */
public class StorageCapacityExceededException extends ErrorResponseException {

  private final long remainingBytes;
  private final long requestedBytes;
  private final long totalBytes;

  public StorageCapacityExceededException(
      long remainingBytes, long requestedBytes, long totalBytes, String detail) {
    super(
        HttpStatus.BAD_REQUEST,
        createProblem(remainingBytes, requestedBytes, totalBytes, detail),
        null);
    this.remainingBytes = remainingBytes;
    this.requestedBytes = requestedBytes;
    this.totalBytes = totalBytes;
  }

  public long getRemainingBytes() {
    return remainingBytes;
  }

  public long getRequestedBytes() {
    return requestedBytes;
  }

  public long getTotalBytes() {
    return totalBytes;
  }

  private static ProblemDetail createProblem(
      long remainingBytes, long requestedBytes, long totalBytes, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Insufficient storage space");
    problem.setDetail(detail);
    problem.setProperty("remaining", remainingBytes);
    problem.setProperty("requested", requestedBytes);
    problem.setProperty("total", totalBytes);
    return problem;
  }
}
