package org.sessionstate.impl;

import org.sessionstate.interfaces.CommandRegistry;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public final class InMemoryCommandRegistry implements CommandRegistry {

    private final TreeMap<String, String> commands = new TreeMap<>();

    @Override
    public Map<String, String> userCommands() {
        return Collections.unmodifiableMap(new TreeMap<>(commands));
    }

    @Override
    public void define(String name, String body) {
        if (name == null || name.isBlank() || body == null) {
            return;
        }
        commands.put(name, body);
    }
}
