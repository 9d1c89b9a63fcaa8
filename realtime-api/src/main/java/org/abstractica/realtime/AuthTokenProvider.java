package org.abstractica.realtime;

import java.util.Optional;

/**
 * Supplies the bearer token used to authenticate the connection.
 *
 * <p>The token is requested on every {@link RealtimeClient#connect()}. An empty
 * or blank token means realtime updates are unavailable; the client logs this
 * and does not try to connect.</p>
 */
@FunctionalInterface
public interface AuthTokenProvider
{
    /**
     * Returns the current access token.
     *
     * @return the token, or empty if the user is not signed in
     */
    Optional<String> currentToken();
}
