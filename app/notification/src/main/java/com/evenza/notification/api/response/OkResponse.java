package com.evenza.notification.api.response;

public record OkResponse(boolean ok) {

  public static final OkResponse OK = new OkResponse(true);
}
