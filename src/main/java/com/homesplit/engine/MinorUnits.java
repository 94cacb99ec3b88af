package com.homesplit.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between decimal amounts at the API boundary and the fixed-point minor units
 * (hundredths) the engine computes with.
 */
public final class MinorUnits {
  public static final int SCALE = 2;

  private MinorUnits() {
  }

  public static long fromDecimal(BigDecimal amount) {
    if (amount == null) {
      throw new IllegalArgumentException("amount is required");
    }
    return amount.setScale(SCALE, RoundingMode.HALF_UP).unscaledValue().longValueExact();
  }

  public static BigDecimal toDecimal(long minor) {
    return BigDecimal.valueOf(minor, SCALE);
  }
}
