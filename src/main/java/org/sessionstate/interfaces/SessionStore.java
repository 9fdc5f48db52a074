package org.sessionstate.interfaces;

public interface SessionStore {

    /**
     * Loads persisted state into the live session.
     *
     * @param reread {@code true} when refreshing a running session, which keeps focus and layout
     * @return whether any state file was found and applied
     */
    boolean load(boolean reread);

    /**
     * Saves live state, merging in changes other instances made since the last load or save.
     * Must be safe to call repeatedly.
     *
     * @return whether the state file was replaced
     */
    boolean save();
}
