package io.github.themoah.feedist.model;

import java.math.BigInteger;

/**
 * Outcome of one token-balance checkpoint.
 *
 * @param timestamp checkpoint time, the new token cursor
 * @param balance distributor balance observed
 * @param distributed amount spread over the elapsed epochs (zero if nothing new arrived)
 * @param epochsCredited number of epochs that received a share
 */
public record TokenCheckpoint(
  long timestamp,
  BigInteger balance,
  BigInteger distributed,
  int epochsCredited
) {}
