package com.gentoro.reformat.sizing;

import java.util.Locale;

/** Conversions between bytes and binary megabytes (MiB). */
public final class ByteUnits {
  public static final long BYTES_PER_MIB = 1_048_576L;

  private ByteUnits() {}

  public static double toMiB(long bytes) {
    if (bytes < 0) {
      throw new IllegalArgumentException("Bytes cannot be negative: " + bytes);
    }
    return (double) bytes / BYTES_PER_MIB;
  }

  public static long fromMiB(double mib) {
    if (mib < 0) {
      throw new IllegalArgumentException("MiB cannot be negative: " + mib);
    }
    return Math.round(mib * BYTES_PER_MIB);
  }

  /** Two decimals, without unit: {@code 1.50}. */
  public static String formatMiB(long bytes) {
    return String.format(Locale.ROOT, "%.2f", toMiB(bytes));
  }
}
