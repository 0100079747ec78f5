package com.ospicorp.kpimonitor.web;

public class InvalidParameterException extends RuntimeException {
  public static final String ERROR_DOCS_BASE = "https://docs.kpi-monitor.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String message, int errorCode, String moreInfo) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public InvalidParameterException(String message, int errorCode) {
    this(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
