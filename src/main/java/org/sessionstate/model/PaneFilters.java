package org.sessionstate.model;

/**
 * Filter state of a pane.
 *
 * @param hideDot whether dot files are hidden
 * @param manual  manual filter expression (a regular expression)
 * @param auto    automatic filter, list of file names
 * @param invert  whether the manual filter is inverted
 */
public record PaneFilters(boolean hideDot, String manual, String auto, boolean invert) {

    public static final PaneFilters DEFAULT = new PaneFilters(false, "", "", true);
}
