package io.github.themoah.feedist.distributor;

import io.github.themoah.feedist.model.ClaimBatch;

/**
 * Raised when a batched claim stops part way. The accounts in {@link #completed()} were
 * paid and their cursors committed; the failing account and those after it were not touched.
 */
public class PartialClaimException extends DistributorException {

  private final ClaimBatch completed;

  public PartialClaimException(DistributorException cause, ClaimBatch completed) {
    super(cause.kind(), cause.getMessage(), cause);
    this.completed = completed;
  }

  public ClaimBatch completed() {
    return completed;
  }
}
