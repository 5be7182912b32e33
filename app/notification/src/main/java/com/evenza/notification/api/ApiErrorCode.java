/*
 * Where: Notification API
 * What: Error codes carried in every error body
 * Why: Distinguishes causes that share an HTTP status
 */
package com.evenza.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  FORBIDDEN,
  NOT_FOUND,
  STATE_CONFLICT,
  DISPATCH_FAILED,
  INTERNAL_ERROR
}
