package io.github.themoah.feedist.distributor;

/**
 * Raised when a distributor operation cannot complete. The operation that throws it
 * leaves no partial state behind, except for {@link PartialClaimException}, which reports
 * the accounts already paid.
 */
public class DistributorException extends RuntimeException {

  private final ErrorKind kind;

  public DistributorException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public DistributorException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public static DistributorException permissionDenied(String caller, String operation) {
    return new DistributorException(ErrorKind.PERMISSION_DENIED,
      "Account '" + caller + "' may not call " + operation);
  }

  public static DistributorException oracleUnavailable(String message, Throwable cause) {
    return new DistributorException(ErrorKind.ORACLE_UNAVAILABLE, message, cause);
  }

  public static DistributorException transferFailed(String message) {
    return new DistributorException(ErrorKind.TRANSFER_FAILED, message);
  }

  public static DistributorException invalidArgument(String message) {
    return new DistributorException(ErrorKind.INVALID_ARGUMENT, message);
  }
}
