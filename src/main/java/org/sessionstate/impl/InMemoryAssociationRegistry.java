package org.sessionstate.impl;

import org.sessionstate.interfaces.AssociationRegistry;
import org.sessionstate.model.AssocKind;
import org.sessionstate.model.Association;
import org.sessionstate.util.AssocCommands;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class InMemoryAssociationRegistry implements AssociationRegistry {

    private final Map<AssocKind, List<Association>> tables = new EnumMap<>(AssocKind.class);

    public InMemoryAssociationRegistry() {
        for (AssocKind kind : AssocKind.values()) {
            tables.put(kind, new ArrayList<>());
        }
    }

    /** Registers a single record, e.g. a builtin one. */
    public void add(AssocKind kind, Association assoc) {
        tables.get(kind).add(assoc);
    }

    @Override
    public List<Association> list(AssocKind kind) {
        return List.copyOf(tables.get(kind));
    }

    @Override
    public boolean exists(AssocKind kind, String matchers, String storedCmd) {
        List<Association> wanted = AssocCommands.decode(matchers, storedCmd);
        if (wanted.isEmpty()) {
            return false;
        }
        List<Association> table = tables.get(kind);
        return wanted.stream().allMatch(w -> table.stream().anyMatch(a ->
                a.matchers().equals(w.matchers())
                        && a.command().equals(w.command())
                        && a.description().equals(w.description())));
    }

    @Override
    public void setPrograms(String matchers, String storedCmd, boolean forX) {
        AssocKind kind = forX ? AssocKind.XFILETYPE : AssocKind.FILETYPE;
        tables.get(kind).addAll(AssocCommands.decode(matchers, storedCmd));
    }

    @Override
    public void setViewers(String matchers, String storedCmd) {
        tables.get(AssocKind.VIEWER).addAll(AssocCommands.decode(matchers, storedCmd));
    }
}
