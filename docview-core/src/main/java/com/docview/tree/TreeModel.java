package com.docview.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Index-based navigation over a parsed document, in the shape tree views expect:
 * every item is addressed by its row under a parent index, with a single column.
 *
 * <p>The root item is hidden; its children are the top-level rows under
 * {@link TreeIndex#INVALID}. Each load replaces the whole tree, so a caller that
 * still holds an item from a previous load sees a stale but consistent snapshot,
 * while indexes from a previous load stop resolving.</p>
 *
 * <p>Models are not thread-safe. Loads must not interleave; route them through a
 * single execution context.</p>
 *
 * @param <I> the item type of the tree variant
 */
public abstract class TreeModel<I extends TreeItem<I>> {

    /** Hard ceiling on the number of items one load may create, the root included. */
    public static final int MAX_NODE_COUNT = 50_000;

    private final List<LoadErrorListener> loadErrorListeners = new CopyOnWriteArrayList<>();
    private I rootItem;
    private LoadError lastError;
    private long generation;

    /**
     * Clears the model, then builds a new tree from {@code text}.
     * Blank input leaves an empty model and counts as success.
     *
     * @return {@code false} if the builder rejected the input; the model is then empty
     *         and {@link #lastError()} describes the failure
     */
    protected final boolean load(String text, Function<String, I> builder) {
        reset();
        if (text == null || text.isBlank()) {
            return true;
        }
        try {
            rootItem = builder.apply(text);
            LOGGER.debug("Loaded {} nodes into {}", totalNodeCount(), getClass().getSimpleName());
            return true;
        } catch (TreeLoadException e) {
            rootItem = null;
            lastError = LoadError.of(e);
            LOGGER.debug("Load failed at {}:{}: {}", e.line(), e.column(), e.getMessage());
            for (LoadErrorListener listener : loadErrorListeners) {
                listener.loadError(lastError.message(), lastError.line(), lastError.column());
            }
            return false;
        }
    }

    /**
     * Drops the tree, the node count and the last error.
     */
    public void clear() {
        reset();
    }

    private void reset() {
        rootItem = null;
        lastError = null;
        generation++;
    }

    public boolean hasIndex(int row, int column, TreeIndex parent) {
        return row >= 0 && column >= 0
            && row < rowCount(parent)
            && column < columnCount(parent);
    }

    public TreeIndex index(int row, int column, TreeIndex parent) {
        if (!hasIndex(row, column, parent)) {
            return TreeIndex.INVALID;
        }
        I parentItem = parent.isValid() ? item(parent) : rootItem;
        if (parentItem == null) {
            return TreeIndex.INVALID;
        }
        I child = parentItem.child(row);
        return child == null ? TreeIndex.INVALID : createIndex(row, column, child);
    }

    public TreeIndex parent(TreeIndex index) {
        I item = item(index);
        if (item == null) {
            return TreeIndex.INVALID;
        }
        I parentItem = item.parent();
        if (parentItem == null || parentItem == rootItem) {
            return TreeIndex.INVALID;
        }
        return createIndex(parentItem.row(), 0, parentItem);
    }

    public int rowCount(TreeIndex parent) {
        if (parent.isValid() && parent.column() > 0) {
            return 0;
        }
        I parentItem = parent.isValid() ? item(parent) : rootItem;
        return parentItem == null ? 0 : parentItem.childCount();
    }

    public int columnCount(TreeIndex parent) {
        return 1;
    }

    /**
     * Resolves an index of the current generation to its item, or {@code null}.
     */
    public I item(TreeIndex index) {
        if (rootItem == null || !index.isValid() || index.generation() != generation) {
            return null;
        }
        ItemArena<I> arena = rootItem.arena();
        return arena.contains(index.itemId()) ? arena.get(index.itemId()) : null;
    }

    /**
     * Index of {@code item}, which must belong to the current tree.
     */
    public TreeIndex indexOf(I item) {
        if (item == null || rootItem == null || item == rootItem || item.arena() != rootItem.arena()) {
            return TreeIndex.INVALID;
        }
        return createIndex(item.row(), 0, item);
    }

    private TreeIndex createIndex(int row, int column, I item) {
        return new TreeIndex(row, column, item.id(), generation);
    }

    public Object data(TreeIndex index, ItemRole role) {
        I item = item(index);
        if (item == null || !supportedRoles().contains(role)) {
            return null;
        }
        return switch (role) {
            case DISPLAY -> displayText(item);
            case KEY -> displayKey(item);
            case VALUE -> item.value();
            case VALUE_TYPE -> item.typeName();
            case PATH -> item.path();
            case CHILD_COUNT -> item.childCount();
            case IS_EXPANDABLE -> item.isExpandable();
            case IS_LAST_CHILD -> item.isLastChild();
            case NAMESPACE_PREFIX -> namespacePrefix(item);
        };
    }

    /**
     * Wire names of the roles this model answers, keyed by role.
     */
    public Map<ItemRole, String> roleNames() {
        Map<ItemRole, String> names = new EnumMap<>(ItemRole.class);
        for (ItemRole role : supportedRoles()) {
            names.put(role, role.roleName());
        }
        return Collections.unmodifiableMap(names);
    }

    protected abstract Set<ItemRole> supportedRoles();

    protected String displayKey(I item) {
        return item.key();
    }

    protected String displayText(I item) {
        Object value = item.value();
        String key = displayKey(item);
        if (value == null || value.toString().isEmpty()) {
            return key;
        }
        return key + ": " + value;
    }

    protected String namespacePrefix(I item) {
        return null;
    }

    public String serializeNode(TreeIndex index) {
        I item = item(index);
        return item == null ? "" : item.serialize();
    }

    public String pathOf(TreeIndex index) {
        I item = item(index);
        return item == null ? "" : item.path();
    }

    public I rootItem() {
        return rootItem;
    }

    public int totalNodeCount() {
        return rootItem == null ? 0 : rootItem.arena().size();
    }

    public Optional<LoadError> lastError() {
        return Optional.ofNullable(lastError);
    }

    public String lastErrorMessage() {
        return lastError == null ? "" : lastError.message();
    }

    public int lastErrorLine() {
        return lastError == null ? 0 : lastError.line();
    }

    public int lastErrorColumn() {
        return lastError == null ? 0 : lastError.column();
    }

    public void addLoadErrorListener(LoadErrorListener listener) {
        loadErrorListeners.add(listener);
    }

    public void removeLoadErrorListener(LoadErrorListener listener) {
        loadErrorListeners.remove(listener);
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeModel.class);
}
