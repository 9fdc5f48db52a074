package org.sessionstate.interfaces;

import org.sessionstate.model.Register;

import java.util.List;

public interface RegisterStore {

    /** @return non-empty registers in the order of {@link Register#VALID_NAMES}. */
    List<Register> list();

    /** Appends a path to a register; invalid names and duplicates are ignored. */
    void append(char name, String file);
}
