package org.sessionstate.interfaces;

import org.sessionstate.model.AssocKind;
import org.sessionstate.model.Association;

import java.util.List;

/**
 * File-type, x-file-type and viewer associations.
 * <p>
 * "Stored" commands use the persisted form: an optional {@code {description}}
 * prefix followed by one or more commands separated by single commas, with
 * literal commas doubled.
 */
public interface AssociationRegistry {

    /** @return associations of the kind in registration order. */
    List<Association> list(AssocKind kind);

    /** @return whether an entry with the matchers and stored command is registered. */
    boolean exists(AssocKind kind, String matchers, String storedCmd);

    /** Registers programs for files matched by {@code matchers}. */
    void setPrograms(String matchers, String storedCmd, boolean forX);

    /** Registers viewers for files matched by {@code matchers}. */
    void setViewers(String matchers, String storedCmd);
}
