package com.homesplit.engine;

/**
 * Base type for input the settlement engine refuses to act on. Engine operations are otherwise
 * total; callers translate these into their own error surface.
 */
public abstract class SettlementException extends RuntimeException {
  protected SettlementException(String message) {
    super(message);
  }
}
