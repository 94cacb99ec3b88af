package com.homesplit.engine;

public class UnknownFrequencyException extends SettlementException {
  public UnknownFrequencyException(String value) {
    super("Unknown recurrence frequency: " + value);
  }
}
