package com.example.common;

import java.util.UUID;

public final class Ids {
  private Ids() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** ランダム UUID の先頭 {@code length} 文字。チャット上で打ち込める短い ID に使う。 */
  public static String newShortId(int length) {
    final String uuid = UUID.randomUUID().toString();
    if (length <= 0 || length > uuid.length()) {
      throw new IllegalArgumentException("length must be between 1 and " + uuid.length());
    }
    return uuid.substring(0, length);
  }
}
