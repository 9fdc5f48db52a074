package org.sessionstate.load;

import org.sessionstate.SessionState;

import java.util.Objects;

/**
 * What a single load works on.
 *
 * @param session live state receiving loaded values
 * @param reread  {@code true} when a running session refreshes its state;
 *                focus, preview, splitter and the current location are kept then
 */
public record LoadContext(SessionState session, boolean reread) {

    public LoadContext {
        Objects.requireNonNull(session, "session");
    }
}
