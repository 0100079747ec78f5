package com.ospicorp.kpimonitor.store;

public class KpiStoreException extends RuntimeException {

  public KpiStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
