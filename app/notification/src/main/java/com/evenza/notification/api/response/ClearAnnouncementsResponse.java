package com.evenza.notification.api.response;

public record ClearAnnouncementsResponse(boolean ok, int deleted) {}
