package org.sessionstate.interfaces;

import java.util.Map;

/** User-defined commands. */
public interface CommandRegistry {

    /** @return name to body, ordered by name. */
    Map<String, String> userCommands();

    /** Defines or redefines a command. */
    void define(String name, String body);
}
