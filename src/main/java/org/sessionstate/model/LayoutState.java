package org.sessionstate.model;

/**
 * Global layout and session-wide flags owned by the UI.
 * Single-threaded; the persistence layer only reads and writes snapshots.
 */
public final class LayoutState {

    private PaneSide activePane = PaneSide.LEFT;
    private boolean preview;
    private SplitOrientation orientation = SplitOrientation.VERTICAL;
    private int splitterPos = -1;
    private int windowCount = 2;
    private boolean useTermMultiplexer;
    private String colorScheme = "";

    public PaneSide activePane() { return activePane; }
    public void setActivePane(PaneSide activePane) { this.activePane = activePane; }

    public boolean preview() { return preview; }
    public void setPreview(boolean preview) { this.preview = preview; }

    public SplitOrientation orientation() { return orientation; }
    public void setOrientation(SplitOrientation orientation) { this.orientation = orientation; }

    public int splitterPos() { return splitterPos; }
    public void setSplitterPos(int splitterPos) { this.splitterPos = splitterPos; }

    /** @return {@code 1} when only the active pane is shown, {@code 2} otherwise. */
    public int windowCount() { return windowCount; }
    public void setWindowCount(int windowCount) { this.windowCount = windowCount == 1 ? 1 : 2; }

    public boolean useTermMultiplexer() { return useTermMultiplexer; }
    public void setUseTermMultiplexer(boolean useTermMultiplexer) { this.useTermMultiplexer = useTermMultiplexer; }

    public String colorScheme() { return colorScheme; }
    public void setColorScheme(String colorScheme) { this.colorScheme = colorScheme == null ? "" : colorScheme; }
}
