package com.firmenakte.aggregate.util;

import com.firmenakte.aggregate.http.HttpFetchResult;
import com.firmenakte.aggregate.http.SourceHttpClient;
import com.firmenakte.aggregate.model.FailureKind;

import java.util.Locale;

public final class FailureClassifier {

  private FailureClassifier() {}

  public static FailureKind fromHttpStatus(int status, boolean sessionSource) {
    if (status == 401 || status == 403) {
      return sessionSource ? FailureKind.AUTH_EXPIRED : FailureKind.RATE_LIMITED;
    }
    // LinkedIn answers unauthenticated scraping with a non-standard 999
    if (status == 999) {
      return sessionSource ? FailureKind.AUTH_EXPIRED : FailureKind.RATE_LIMITED;
    }
    if (status == 404 || status == 410) {
      return FailureKind.RECORD_NOT_FOUND;
    }
    if (status == 408 || status == 504) {
      return FailureKind.TIMEOUT;
    }
    if (status == 429) {
      return FailureKind.RATE_LIMITED;
    }
    if (status >= 500 && status < 600) {
      return FailureKind.TRANSIENT_NETWORK;
    }
    return FailureKind.MALFORMED_RESPONSE;
  }

  public static FailureKind fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return FailureKind.TRANSIENT_NETWORK;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains(SourceHttpClient.ERROR_TIMEOUT) || code.contains(SourceHttpClient.ERROR_INTERRUPTED)) {
      return FailureKind.TIMEOUT;
    }
    if (code.contains(SourceHttpClient.ERROR_INVALID_URL)) {
      return FailureKind.MALFORMED_RESPONSE;
    }
    String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
    if (lower.contains("timed out")) {
      return FailureKind.TIMEOUT;
    }
    return FailureKind.TRANSIENT_NETWORK;
  }

  /** Returns null when the fetch succeeded. */
  public static FailureKind classify(HttpFetchResult result, boolean sessionSource) {
    if (result == null) {
      return FailureKind.TRANSIENT_NETWORK;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    if (result.isSuccessful()) {
      return null;
    }
    return fromHttpStatus(result.statusCode(), sessionSource);
  }

  public static String describe(HttpFetchResult result) {
    if (result == null) {
      return "no_response";
    }
    if (result.errorCode() != null) {
      String message = result.errorMessage() == null ? "" : ": " + result.errorMessage();
      return result.errorCode() + message;
    }
    return "http_" + result.statusCode() + " " + result.finalUrlOrRequested();
  }
}
