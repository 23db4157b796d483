package com.streamraid.engine.auth;

import com.streamraid.engine.model.AccessContext;
import com.streamraid.engine.model.Platform;

/** Supplies platform credentials for a participant. */
public interface AuthorizationProvider {

  /**
   * Returns credentials usable right now.
   *
   * @throws UnauthenticatedException when no authorization is linked or it has expired
   */
  AccessContext getValidAccessContext(Platform platform, String participantId);
}
