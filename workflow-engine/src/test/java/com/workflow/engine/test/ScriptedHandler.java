package com.workflow.engine.test;

import com.workflow.handler.StepHandler;
import com.workflow.handler.StepHandlerContext;
import com.workflow.handler.StepHandlerException;
import com.workflow.handler.StepResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Step handler with scripted behavior for tests.
 * Records every invocation and fails the first {@code failures} of them.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ScriptedHandler flaky = ScriptedHandler.failingTimes(2);
 * handlers.register("charge", flaky);
 * // ... run the workflow ...
 * assertThat(flaky.invocations()).isEqualTo(3);
 * }</pre>
 */
public class ScriptedHandler implements StepHandler {

    private final int failures;
    private final boolean retryable;
    private final Map<String, Object> contextUpdates;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<StepHandlerContext> contexts = new CopyOnWriteArrayList<>();

    private ScriptedHandler(int failures, boolean retryable, Map<String, Object> contextUpdates) {
        this.failures = failures;
        this.retryable = retryable;
        this.contextUpdates = contextUpdates;
    }

    public static ScriptedHandler succeeding() {
        return new ScriptedHandler(0, true, Map.of());
    }

    public static ScriptedHandler succeedingWith(Map<String, Object> contextUpdates) {
        return new ScriptedHandler(0, true, contextUpdates);
    }

    public static ScriptedHandler failingTimes(int failures) {
        return new ScriptedHandler(failures, true, Map.of());
    }

    public static ScriptedHandler alwaysFailing() {
        return new ScriptedHandler(Integer.MAX_VALUE, true, Map.of());
    }

    public static ScriptedHandler permanentlyFailing() {
        return new ScriptedHandler(Integer.MAX_VALUE, false, Map.of());
    }

    @Override
    public StepResult handle(StepHandlerContext context) throws StepHandlerException {
        contexts.add(context);
        int attempt = invocations.incrementAndGet();
        if (attempt <= failures) {
            throw new StepHandlerException("SCRIPTED_FAILURE", "Scripted failure #" + attempt, retryable);
        }
        return StepResult.success(contextUpdates);
    }

    public int invocations() {
        return invocations.get();
    }

    public List<StepHandlerContext> contexts() {
        return List.copyOf(contexts);
    }
}
