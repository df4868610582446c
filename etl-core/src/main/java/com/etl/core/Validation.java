package com.etl.core;

public record Validation(boolean valid, String reason) {
  private static final Validation OK = new Validation(true, null);

  public Validation {
    if (!valid && (reason == null || reason.isBlank())) {
      throw new IllegalArgumentException("an invalid result needs a reason");
    }
  }

  public static Validation ok() {
    return OK;
  }

  public static Validation invalid(String reason) {
    return new Validation(false, reason);
  }
}
