package org.sessionstate;

import org.sessionstate.config.InfoCategory;
import org.sessionstate.config.StateConfig;
import org.sessionstate.impl.InMemoryAssociationRegistry;
import org.sessionstate.impl.InMemoryBookmarkStore;
import org.sessionstate.impl.InMemoryCommandRegistry;
import org.sessionstate.impl.InMemoryDirStack;
import org.sessionstate.impl.InMemoryMarkStore;
import org.sessionstate.impl.InMemoryRegisterStore;
import org.sessionstate.impl.InMemoryTrashStore;
import org.sessionstate.impl.MapOptionsEngine;
import org.sessionstate.impl.SimplePaneView;
import org.sessionstate.interfaces.AssociationRegistry;
import org.sessionstate.interfaces.BookmarkStore;
import org.sessionstate.interfaces.CommandRegistry;
import org.sessionstate.interfaces.DirStack;
import org.sessionstate.interfaces.MarkStore;
import org.sessionstate.interfaces.OptionsEngine;
import org.sessionstate.interfaces.PaneView;
import org.sessionstate.interfaces.RegisterStore;
import org.sessionstate.interfaces.TrashStore;
import org.sessionstate.model.History;
import org.sessionstate.model.HistoryKind;
import org.sessionstate.model.LayoutState;
import org.sessionstate.model.PaneSide;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Live state of one application instance, as seen by the persistence layer.
 * <p>
 * Bundles the collaborating subsystems together with the history length,
 * which grows when loaded state doesn't fit. Use {@link #builder(StateConfig)};
 * anything not supplied gets an in-memory implementation.
 */
public final class SessionState {

    private final StateConfig config;
    private final LayoutState layout;
    private final Map<PaneSide, PaneView> panes = new EnumMap<>(PaneSide.class);
    private final OptionsEngine options;
    private final AssociationRegistry associations;
    private final CommandRegistry commands;
    private final MarkStore marks;
    private final BookmarkStore bookmarks;
    private final RegisterStore registers;
    private final DirStack dirStack;
    private final TrashStore trash;
    private final Map<HistoryKind, History> histories = new EnumMap<>(HistoryKind.class);
    private int historyLength;

    private SessionState(Builder b) {
        this.config = b.config;
        this.historyLength = b.config.historyLength();
        this.layout = b.layout != null ? b.layout : new LayoutState();
        this.panes.put(PaneSide.LEFT, b.left != null ? b.left : new SimplePaneView("", historyLength));
        this.panes.put(PaneSide.RIGHT, b.right != null ? b.right : new SimplePaneView("", historyLength));
        this.options = b.options != null ? b.options : new MapOptionsEngine();
        this.associations = b.associations != null ? b.associations : new InMemoryAssociationRegistry();
        this.commands = b.commands != null ? b.commands : new InMemoryCommandRegistry();
        this.marks = b.marks != null ? b.marks : new InMemoryMarkStore();
        this.bookmarks = b.bookmarks != null ? b.bookmarks : new InMemoryBookmarkStore();
        this.registers = b.registers != null ? b.registers : new InMemoryRegisterStore();
        this.dirStack = b.dirStack != null ? b.dirStack : new InMemoryDirStack();
        this.trash = b.trash != null ? b.trash : new InMemoryTrashStore();
        for (HistoryKind kind : HistoryKind.values()) {
            histories.put(kind, new History(historyLength));
        }
    }

    public static Builder builder(StateConfig config) {
        return new Builder(config);
    }

    public StateConfig config() { return config; }
    public boolean has(InfoCategory category) { return config.has(category); }
    public LayoutState layout() { return layout; }
    public PaneView pane(PaneSide side) { return panes.get(side); }
    public OptionsEngine options() { return options; }
    public AssociationRegistry associations() { return associations; }
    public CommandRegistry commands() { return commands; }
    public MarkStore marks() { return marks; }
    public BookmarkStore bookmarks() { return bookmarks; }
    public RegisterStore registers() { return registers; }
    public DirStack dirStack() { return dirStack; }
    public TrashStore trash() { return trash; }
    public History history(HistoryKind kind) { return histories.get(kind); }

    /** @return current capacity shared by all histories. */
    public int historyLength() {
        return historyLength;
    }

    /** Grows every history (string and directory ones) by one slot. */
    public void growHistoryLength() {
        historyLength++;
        histories.values().forEach(h -> h.resize(historyLength));
        panes.values().forEach(p -> p.resizeHistory(historyLength));
    }

    public static final class Builder {
        private final StateConfig config;
        private LayoutState layout;
        private PaneView left;
        private PaneView right;
        private OptionsEngine options;
        private AssociationRegistry associations;
        private CommandRegistry commands;
        private MarkStore marks;
        private BookmarkStore bookmarks;
        private RegisterStore registers;
        private DirStack dirStack;
        private TrashStore trash;

        private Builder(StateConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder layout(LayoutState layout) { this.layout = layout; return this; }
        public Builder panes(PaneView left, PaneView right) { this.left = left; this.right = right; return this; }
        public Builder options(OptionsEngine options) { this.options = options; return this; }
        public Builder associations(AssociationRegistry associations) { this.associations = associations; return this; }
        public Builder commands(CommandRegistry commands) { this.commands = commands; return this; }
        public Builder marks(MarkStore marks) { this.marks = marks; return this; }
        public Builder bookmarks(BookmarkStore bookmarks) { this.bookmarks = bookmarks; return this; }
        public Builder registers(RegisterStore registers) { this.registers = registers; return this; }
        public Builder dirStack(DirStack dirStack) { this.dirStack = dirStack; return this; }
        public Builder trash(TrashStore trash) { this.trash = trash; return this; }

        public SessionState build() {
            return new SessionState(this);
        }
    }
}
