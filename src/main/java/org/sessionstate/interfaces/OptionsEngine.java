package org.sessionstate.interfaces;

import org.sessionstate.model.PaneSide;

/**
 * Option recognition and execution. Consumes {@code :set}-style arguments
 * ({@code key=value}, {@code key}, {@code nokey}) and reports current values.
 */
public interface OptionsEngine {

    /** Applies an argument to global options. */
    void apply(String arg);

    /** Applies an argument to options local to a pane. */
    void applyLocal(PaneSide pane, String arg);

    /** @return current value of a global boolean option, {@code false} if unknown. */
    boolean flag(String name);

    /** @return current value of a global valued option, empty if unknown. */
    String text(String name);

    boolean localFlag(PaneSide pane, String name);

    String localText(PaneSide pane, String name);
}
