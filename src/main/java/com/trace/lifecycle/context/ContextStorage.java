package com.trace.lifecycle.context;

import java.util.concurrent.Callable;

/**
 * Binds {@link TraceContext}s to threads.
 *
 * <p>Uses a plain (non-inheritable) {@link ThreadLocal}: threads never inherit their
 * creator's context. Sharing a context across threads requires an explicit call to
 * {@link #attach(TraceContext)} or one of the {@code propagate} wrappers.</p>
 *
 * <h2>Executor usage:</h2>
 * <pre>
 * executor.submit(storage.propagate(() -&gt; {
 *     // spans started here join the submitting thread's trace
 *     doWork();
 * }));
 * </pre>
 */
public final class ContextStorage {

    private final ThreadLocal<TraceContext> contexts = ThreadLocal.withInitial(TraceContext::new);

    /**
     * Returns the context attached to the calling thread, creating an empty one if needed.
     */
    public TraceContext current() {
        return contexts.get();
    }

    /**
     * Forks the calling thread's context for use on another thread.
     */
    public TraceContext capture() {
        return current().fork();
    }

    /**
     * Attaches {@code context} to the calling thread until the returned scope is closed.
     */
    public ContextScope attach(TraceContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        TraceContext previous = contexts.get();
        contexts.set(context);
        return () -> contexts.set(previous);
    }

    /**
     * Captures the calling thread's context and returns a {@link Runnable} that
     * runs {@code task} with it attached.
     */
    public Runnable propagate(Runnable task) {
        TraceContext captured = capture();
        return () -> {
            try (ContextScope ignored = attach(captured)) {
                task.run();
            }
        };
    }

    /**
     * Captures the calling thread's context and returns a {@link Callable} that
     * runs {@code task} with it attached.
     *
     * @param <T> the return type
     */
    public <T> Callable<T> propagate(Callable<T> task) {
        TraceContext captured = capture();
        return () -> {
            try (ContextScope ignored = attach(captured)) {
                return task.call();
            }
        };
    }
}
