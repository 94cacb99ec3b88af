package com.homesplit.engine;

public class InvalidSplitException extends SettlementException {
  public InvalidSplitException(String message) {
    super(message);
  }
}
