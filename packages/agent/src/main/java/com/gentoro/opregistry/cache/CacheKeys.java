package com.gentoro.opregistry.cache;

/** Cache key layout for registered operations. */
public final class CacheKeys {
  public static final String PREFIX = "apq:";

  private CacheKeys() {}

  public static String forSignature(String signature) {
    return PREFIX + signature;
  }
}
