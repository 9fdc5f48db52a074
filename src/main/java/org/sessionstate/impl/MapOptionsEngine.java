package org.sessionstate.impl;

import org.sessionstate.interfaces.OptionsEngine;
import org.sessionstate.model.PaneSide;
import org.sessionstate.serialize.OptionCatalog;
import org.sessionstate.util.OptionText;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Options kept as strings in maps. Understands {@code key=value},
 * {@code key+=value}, {@code key}, {@code nokey} and {@code invkey}.
 */
public final class MapOptionsEngine implements OptionsEngine {

    // Flags such as "number" that would otherwise read as a negation.
    private static final Set<String> KNOWN_FLAGS = Stream.concat(
                    OptionCatalog.GLOBAL.stream(), OptionCatalog.VIEW.stream())
            .filter(spec -> spec.kind() == OptionCatalog.Kind.BOOL)
            .map(OptionCatalog.OptionSpec::name)
            .collect(Collectors.toUnmodifiableSet());

    private final Map<String, String> global = new HashMap<>();
    private final Map<PaneSide, Map<String, String>> local = new EnumMap<>(PaneSide.class);

    public MapOptionsEngine() {
        for (PaneSide side : PaneSide.values()) {
            local.put(side, new HashMap<>());
        }
    }

    @Override
    public void apply(String arg) {
        applyTo(global, arg);
    }

    @Override
    public void applyLocal(PaneSide pane, String arg) {
        applyTo(local.get(pane), arg);
    }

    @Override
    public boolean flag(String name) {
        return Boolean.parseBoolean(global.get(name));
    }

    @Override
    public String text(String name) {
        return global.getOrDefault(name, "");
    }

    @Override
    public boolean localFlag(PaneSide pane, String name) {
        return Boolean.parseBoolean(local.get(pane).get(name));
    }

    @Override
    public String localText(PaneSide pane, String name) {
        return local.get(pane).getOrDefault(name, "");
    }

    private static void applyTo(Map<String, String> values, String arg) {
        if (arg == null || arg.isBlank()) {
            return;
        }
        String a = arg.strip();
        int eq = a.indexOf('=');
        if (eq > 0) {
            boolean append = a.charAt(eq - 1) == '+';
            String key = a.substring(0, append ? eq - 1 : eq);
            String value = OptionText.unescape(a.substring(eq + 1));
            values.put(key, append ? values.getOrDefault(key, "") + value : value);
        } else if (KNOWN_FLAGS.contains(a)) {
            values.put(a, "true");
        } else if (a.startsWith("no") && a.length() > 2) {
            values.put(a.substring(2), "false");
        } else if (a.startsWith("inv") && a.length() > 3) {
            String key = a.substring(3);
            values.put(key, String.valueOf(!Boolean.parseBoolean(values.get(key))));
        } else {
            values.put(a, "true");
        }
    }
}
