package org.sessionstate.impl;

import org.sessionstate.interfaces.MarkStore;
import org.sessionstate.model.Mark;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryMarkStore implements MarkStore {

    private final Map<Character, Mark> marks = new HashMap<>();

    @Override
    public List<Mark> list() {
        List<Mark> out = new ArrayList<>(marks.values());
        out.sort(Comparator.comparingInt(m -> Mark.VALID_NAMES.indexOf(m.name())));
        return out;
    }

    @Override
    public Optional<Mark> find(char name) {
        return Optional.ofNullable(marks.get(name));
    }

    @Override
    public void setup(Mark mark) {
        if (mark == null || !Mark.isValidName(mark.name())) {
            return;
        }
        marks.put(mark.name(), mark);
    }
}
