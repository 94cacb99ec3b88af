package com.homesplit.engine;

public enum ChangeStatus {
  APPLIED,
  NO_CHANGE,
  UNKNOWN_REFERENCE
}
