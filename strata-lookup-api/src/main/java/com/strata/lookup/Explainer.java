package com.strata.lookup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects a trace of a lookup: which tiers, providers, locations and segments were consulted and what was
 * found. Each event is an indented line; nesting follows {@link Invocation#with}. Lines are also logged
 * at debug level.
 */
public final class Explainer {

    private static final Logger log = LoggerFactory.getLogger(Explainer.class);

    private final boolean explainOptions;
    private final boolean onlyExplainOptions;
    private final List<String> lines = new ArrayList<>();
    private final List<String> events = new ArrayList<>();
    private int depth;

    public Explainer() {
        this(false, false);
    }

    /**
     * @param explainOptions     also trace the resolution of {@code lookup_options}
     * @param onlyExplainOptions trace only {@code lookup_options}; the lookup produces no data
     */
    public Explainer(boolean explainOptions, boolean onlyExplainOptions) {
        this.explainOptions = explainOptions || onlyExplainOptions;
        this.onlyExplainOptions = onlyExplainOptions;
    }

    public boolean isExplainOptions() {
        return explainOptions;
    }

    public boolean isOnlyExplainOptions() {
        return onlyExplainOptions;
    }

    void push(String qualifierType, Object qualifier) {
        add(qualifierType, String.valueOf(qualifier));
        depth++;
    }

    void pop() {
        if (depth > 0) depth--;
    }

    /**
     * Records one event.
     *
     * @param event event type (e.g. {@code found}, {@code not_found}, {@code invalid_key})
     * @param text  human readable detail
     */
    void accept(String event, String text) {
        add(event, text);
    }

    private void add(String event, String text) {
        String line = "  ".repeat(depth) + event + (text == null || text.isEmpty() ? "" : ": " + text);
        lines.add(line);
        events.add(event);
        log.debug("lookup explain {}", line);
    }

    /** Event types recorded so far, in order (e.g. {@code ["data", "global", "not_found"]}). */
    public List<String> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /** Whether an event of the given type was recorded. */
    public boolean hasEvent(String event) {
        return events.contains(event);
    }

    /** The whole trace, one event per line. */
    public String explain() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return explain();
    }
}
