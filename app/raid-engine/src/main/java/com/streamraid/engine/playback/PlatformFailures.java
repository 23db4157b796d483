package com.streamraid.engine.playback;

import com.google.common.base.Throwables;
import java.net.SocketTimeoutException;
import org.springframework.web.client.RestClientResponseException;

/** Maps HTTP failures of platform calls to verification reasons. */
final class PlatformFailures {

  private PlatformFailures() {}

  static PlaybackVerificationException fromResponse(
      String platform, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new PlaybackVerificationException(
          PlaybackVerificationException.Reason.AUTH_EXPIRED,
          platform + " rejected credentials status=" + status,
          ex);
    }
    if (status == 429) {
      final String retryAfter =
          ex.getResponseHeaders() == null ? null : ex.getResponseHeaders().getFirst("Retry-After");
      return new PlaybackVerificationException(
          PlaybackVerificationException.Reason.RATE_LIMITED,
          platform + " rate limited retryAfter=" + retryAfter,
          ex);
    }
    return new PlaybackVerificationException(
        PlaybackVerificationException.Reason.PLATFORM_UNAVAILABLE,
        platform + " request failed status=" + status,
        ex);
  }

  static boolean isTimeout(Throwable ex) {
    return Throwables.getCausalChain(ex).stream().anyMatch(SocketTimeoutException.class::isInstance);
  }
}
