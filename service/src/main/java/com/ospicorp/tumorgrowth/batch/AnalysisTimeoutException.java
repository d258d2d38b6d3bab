package com.ospicorp.tumorgrowth.batch;

public class AnalysisTimeoutException extends RuntimeException {

  public AnalysisTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
