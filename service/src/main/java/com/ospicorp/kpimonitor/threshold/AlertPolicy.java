package com.ospicorp.kpimonitor.threshold;

/**
 * Signal-count cut-offs for the Yellow and Red statuses.
 */
public record AlertPolicy(int yellowAt, int redAt) {

  public static final int DEFAULT_YELLOW_AT = 1;
  public static final int DEFAULT_RED_AT = 2;

  /** Two corroborating signals before a metric turns Red. */
  public static final AlertPolicy DYNAMIC_DEFAULT = new AlertPolicy(DEFAULT_YELLOW_AT, DEFAULT_RED_AT);

  /** Any single breach is Red; used for hand-tuned static bounds without an explicit policy. */
  public static final AlertPolicy STRICT = new AlertPolicy(1, 1);
}
