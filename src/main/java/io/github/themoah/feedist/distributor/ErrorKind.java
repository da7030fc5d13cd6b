package io.github.themoah.feedist.distributor;

/**
 * Failure categories raised by the distributor and its collaborators.
 */
public enum ErrorKind {
  PERMISSION_DENIED("permission_denied"),
  ORACLE_UNAVAILABLE("oracle_unavailable"),
  TRANSFER_FAILED("transfer_failed"),
  INVALID_ARGUMENT("invalid_argument");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
