package org.sessionstate.impl;

import org.sessionstate.interfaces.RegisterStore;
import org.sessionstate.model.Register;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class InMemoryRegisterStore implements RegisterStore {

    private final Map<Character, List<String>> registers = new HashMap<>();

    @Override
    public List<Register> list() {
        List<Register> out = new ArrayList<>();
        for (char name : Register.VALID_NAMES.toCharArray()) {
            List<String> files = registers.get(name);
            if (files != null && !files.isEmpty()) {
                out.add(new Register(name, files));
            }
        }
        return out;
    }

    @Override
    public void append(char name, String file) {
        if (!Register.isValidName(name) || file == null) {
            return;
        }
        List<String> files = registers.computeIfAbsent(name, n -> new ArrayList<>());
        if (!files.contains(file)) {
            files.add(file);
        }
    }
}
