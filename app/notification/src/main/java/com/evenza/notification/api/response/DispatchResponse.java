package com.evenza.notification.api.response;

import com.evenza.notification.model.DispatchResult;

public record DispatchResponse(int inserted, int requested) {

  public static DispatchResponse from(DispatchResult result) {
    return new DispatchResponse(result.inserted(), result.requested());
  }
}
