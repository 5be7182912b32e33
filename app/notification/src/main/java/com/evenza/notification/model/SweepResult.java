package com.evenza.notification.model;

/** Outcome of one sweep tick. */
public record SweepResult(int due, int dispatched, int failed, int promoted) {

  public boolean isIdle() {
    return due == 0 && promoted == 0;
  }
}
