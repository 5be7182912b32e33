package com.evenza.notification.api.response;

public record BulkCreateResponse(boolean ok, int inserted, int requested) {}
