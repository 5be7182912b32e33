package com.evenza.notification.model;

public record DispatchResult(int inserted, int requested) {

  public static DispatchResult empty() {
    return new DispatchResult(0, 0);
  }
}
