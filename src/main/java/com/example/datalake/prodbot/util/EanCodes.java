package com.example.datalake.prodbot.util;

/**
 * GTIN/EAN check digit validation for 8, 12, 13 and 14 digit codes.
 */
public final class EanCodes {

  private EanCodes() {}

  public static boolean isValid(String code) {
    if (code == null) return false;
    int len = code.length();
    if (len != 8 && len != 12 && len != 13 && len != 14) return false;
    for (int i = 0; i < len; i++) {
      char c = code.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    int expected = checkDigit(code.substring(0, len - 1));
    return expected == code.charAt(len - 1) - '0';
  }

  /**
   * Check digit for the given payload: digits weighted 3,1,3,... from the right.
   */
  public static int checkDigit(String payload) {
    int sum = 0;
    for (int i = 0; i < payload.length(); i++) {
      int digit = payload.charAt(payload.length() - 1 - i) - '0';
      sum += (i % 2 == 0) ? digit * 3 : digit;
    }
    return (10 - sum % 10) % 10;
  }
}
