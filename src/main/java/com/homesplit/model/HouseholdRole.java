package com.homesplit.model;

public enum HouseholdRole {
  OWNER,
  MEMBER
}
