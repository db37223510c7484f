package com.trace.lifecycle.context;

import com.trace.lifecycle.tracing.LiveSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Explicit execution context: the stack of spans opened by one unit of execution.
 *
 * <p>A context is confined to the thread it is attached to. Separate threads start with
 * separate, empty contexts, so concurrent work produces disjoint traces unless a context
 * is explicitly shared with {@link #fork()} and attached on the other thread.</p>
 *
 * <p>A forked context sees the captured span as its base parent but cannot end it;
 * only spans pushed onto the fork's own stack can be ended from it.</p>
 */
public final class TraceContext {

    private LiveSpan baseParent;
    private final Deque<LiveSpan> stack = new ArrayDeque<>();

    public TraceContext() {
        this(null);
    }

    private TraceContext(LiveSpan baseParent) {
        this.baseParent = baseParent;
    }

    /**
     * Returns the innermost open span, falling back to the inherited parent of a forked context.
     */
    public Optional<LiveSpan> currentSpan() {
        LiveSpan top = stack.peek();
        return Optional.ofNullable(top != null ? top : baseParent);
    }

    /**
     * Creates a new context whose base parent is this context's current span.
     */
    public TraceContext fork() {
        return new TraceContext(currentSpan().orElse(null));
    }

    public void push(LiveSpan span) {
        stack.push(span);
    }

    /**
     * Finds an open span of this context by identifier.
     */
    public Optional<LiveSpan> find(String spanId) {
        for (LiveSpan span : stack) {
            if (span.getSpanId().equals(spanId)) {
                return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    /**
     * Pops {@code target} and every span above it.
     *
     * @return the spans that were above {@code target}, innermost first
     * @throws IllegalArgumentException if {@code target} is not on the stack
     */
    public List<LiveSpan> popThrough(LiveSpan target) {
        if (!stack.contains(target)) {
            throw new IllegalArgumentException("Span " + target.getSpanId() + " is not on this context's stack");
        }
        List<LiveSpan> above = new ArrayList<>();
        LiveSpan popped;
        while ((popped = stack.pop()) != target) {
            above.add(popped);
        }
        return above;
    }

    /**
     * Drops every span whose trace is no longer in progress, such as the spans of a trace
     * the timeout supervisor closed while its root was still open here.
     *
     * @return the number of spans dropped
     */
    public int pruneFinished() {
        int pruned = 0;
        Iterator<LiveSpan> it = stack.iterator();
        while (it.hasNext()) {
            if (!it.next().getTrace().isInProgress()) {
                it.remove();
                pruned++;
            }
        }
        if (baseParent != null && !baseParent.getTrace().isInProgress()) {
            baseParent = null;
            pruned++;
        }
        return pruned;
    }

    public int depth() {
        return stack.size();
    }

    public boolean isEmpty() {
        return stack.isEmpty() && baseParent == null;
    }
}
