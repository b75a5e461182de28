package com.docview.bridge;

import com.docview.format.FormatResult;
import com.docview.format.IndentStyle;
import com.docview.format.JsonFormatter;
import com.docview.format.ValidationResult;
import com.docview.format.XmlFormatter;
import com.docview.gate.GateListener;
import com.docview.gate.TaskGate;
import com.docview.jackson.DocviewJackson;
import com.docview.tree.TreeIndex;
import com.docview.tree.json.JsonTreeModel;
import com.docview.tree.xml.XmlTreeModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for front ends. Every request that parses or rewrites a document goes
 * through the {@link TaskGate}, so at most one of them runs at a time and they run in
 * the order they were made.
 *
 * <p>The tree models are only mutated on the gate thread. Read them after the future
 * of the load that filled them has completed, and not while another load is queued.</p>
 */
public class DocumentBridge {

    private final TaskGate gate;
    private final JsonTreeModel jsonModel;
    private final XmlTreeModel xmlModel;
    private final JsonFormatter jsonFormatter;
    private final XmlFormatter xmlFormatter;
    private final ObjectMapper mapper;
    private final List<BridgeListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean busy;

    public DocumentBridge(TaskGate gate) {
        this(gate, new JsonTreeModel(), new XmlTreeModel(), new JsonFormatter(), new XmlFormatter(),
            DocviewJackson.createObjectMapper());
    }

    public DocumentBridge(TaskGate gate,
                          JsonTreeModel jsonModel,
                          XmlTreeModel xmlModel,
                          JsonFormatter jsonFormatter,
                          XmlFormatter xmlFormatter,
                          ObjectMapper mapper) {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.jsonModel = Objects.requireNonNull(jsonModel, "jsonModel");
        this.xmlModel = Objects.requireNonNull(xmlModel, "xmlModel");
        this.jsonFormatter = Objects.requireNonNull(jsonFormatter, "jsonFormatter");
        this.xmlFormatter = Objects.requireNonNull(xmlFormatter, "xmlFormatter");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        jsonModel.addLoadErrorListener(this::reportLoadError);
        xmlModel.addLoadErrorListener(this::reportLoadError);
        gate.addListener(new BusyTracker());
    }

    public void addListener(BridgeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(BridgeListener listener) {
        listeners.remove(listener);
    }

    public CompletableFuture<FormatResult> formatJson(String input, String indentSelector) {
        return run("formatJson", FormatResult.class,
            () -> withIndent(indentSelector, style -> jsonFormatter.format(input, style)),
            result -> notifyListeners(l -> l.formatCompleted(result)));
    }

    public CompletableFuture<FormatResult> minifyJson(String input) {
        return run("minifyJson", FormatResult.class,
            () -> jsonFormatter.minify(input),
            result -> notifyListeners(l -> l.minifyCompleted(result)));
    }

    public CompletableFuture<ValidationResult> validateJson(String input) {
        return run("validateJson", ValidationResult.class,
            () -> jsonFormatter.validate(input),
            result -> notifyListeners(l -> l.validateCompleted(result)));
    }

    public CompletableFuture<FormatResult> formatXml(String input, String indentSelector) {
        return run("formatXml", FormatResult.class,
            () -> withIndent(indentSelector, style -> xmlFormatter.format(input, style)),
            result -> notifyListeners(l -> l.xmlFormatCompleted(result)));
    }

    public CompletableFuture<FormatResult> minifyXml(String input) {
        return run("minifyXml", FormatResult.class,
            () -> xmlFormatter.minify(input),
            result -> notifyListeners(l -> l.xmlMinifyCompleted(result)));
    }

    /**
     * Replaces the JSON tree. Completes with {@code false} when the text was rejected;
     * {@link #jsonModel()} then holds the error.
     */
    public CompletableFuture<Boolean> loadJsonTree(String input) {
        return run("loadJsonTree", Boolean.class,
            () -> jsonModel.loadJson(input),
            success -> notifyListeners(l -> l.jsonTreeLoaded(success, jsonModel.totalNodeCount())));
    }

    public CompletableFuture<Boolean> loadXmlTree(String input) {
        return run("loadXmlTree", Boolean.class,
            () -> xmlModel.loadXml(input),
            success -> notifyListeners(l -> l.xmlTreeLoaded(success, xmlModel.totalNodeCount())));
    }

    /**
     * JSON text of the node at {@code index}, indented or on one line.
     */
    public String serializeJsonNode(TreeIndex index, boolean compact) {
        return compact ? jsonModel.serializeNodeCompact(index) : jsonModel.serializeNode(index);
    }

    public String serializeXmlNode(TreeIndex index) {
        return xmlModel.serializeNode(index);
    }

    /**
     * Wire form of a result record.
     */
    public String toJson(Object result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + result, e);
        }
    }

    /**
     * {@code true} while a task is in flight or waiting in the gate.
     */
    public boolean isBusy() {
        return gate.isBusy() || gate.queueLength() > 0;
    }

    public JsonTreeModel jsonModel() {
        return jsonModel;
    }

    public XmlTreeModel xmlModel() {
        return xmlModel;
    }

    private <T> CompletableFuture<T> run(String taskName, Class<T> type, Supplier<T> work, Consumer<T> report) {
        return gate.submit(taskName, () -> {
            T result = work.get();
            report.accept(result);
            return CompletableFuture.completedFuture(result);
        }).thenApply(type::cast);
    }

    private static FormatResult withIndent(String selector, Function<IndentStyle, FormatResult> format) {
        IndentStyle style;
        try {
            style = selector == null || selector.isEmpty() ? IndentStyle.TWO_SPACES : IndentStyle.parse(selector);
        } catch (IllegalArgumentException e) {
            return FormatResult.failure(e.getMessage());
        }
        return format.apply(style);
    }

    private void reportLoadError(String message, int line, int column) {
        notifyListeners(l -> l.loadError(message, line, column));
    }

    private void notifyListeners(Consumer<BridgeListener> event) {
        for (BridgeListener listener : listeners) {
            event.accept(listener);
        }
    }

    private final class BusyTracker implements GateListener {
        @Override
        public void taskStarted(String taskName) {
            update();
        }

        @Override
        public void taskCompleted(String taskName, boolean success) {
            update();
        }

        @Override
        public void taskTimedOut(String taskName) {
            update();
        }

        @Override
        public void queueLengthChanged(int length) {
            update();
        }

        private void update() {
            boolean now = isBusy();
            if (now != busy) {
                busy = now;
                LOGGER.debug("Bridge busy: {}", now);
                notifyListeners(l -> l.busyChanged(now));
            }
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentBridge.class);
}
