package com.eainde.orchestrator.processor;

import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.agent.tool.ToolSpecifications;
import dev.langchain4j.service.tool.DefaultToolExecutor;
import dev.langchain4j.service.tool.ToolExecutor;
import lombok.extern.log4j.Log4j2;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the tool invocations requested in one model turn concurrently and waits for all of them.
 * <p>
 * A failing invocation does not cancel the others: it yields a failed {@link ToolResult}
 * whose text describes the error, so the model can still work with whatever succeeded.
 */
@Log4j2
public class ToolFanOut {

    private final Map<String, ToolExecutor> executors;
    private final List<ToolSpecification> specifications;
    private final Executor executor;

    public ToolFanOut(Map<String, ToolExecutor> executors, List<ToolSpecification> specifications, Executor executor) {
        this.executors = Map.copyOf(executors);
        this.specifications = List.copyOf(specifications);
        this.executor = executor;
    }

    /**
     * Collects every {@link Tool}-annotated method of the given objects.
     */
    public static ToolFanOut of(Collection<Object> toolObjects, Executor executor) {
        Map<String, ToolExecutor> executors = new LinkedHashMap<>();
        List<ToolSpecification> specifications = new ArrayList<>();
        for (Object toolObject : toolObjects) {
            Map<String, Method> methods = toolMethods(toolObject);
            for (ToolSpecification specification : ToolSpecifications.toolSpecificationsFrom(toolObject)) {
                ToolExecutor toolExecutor = new DefaultToolExecutor(toolObject, methods.get(specification.name()));
                if (executors.putIfAbsent(specification.name(), toolExecutor) != null) {
                    throw new IllegalArgumentException("Duplicate tool name: " + specification.name());
                }
                specifications.add(specification);
            }
        }
        return new ToolFanOut(executors, specifications, executor);
    }

    private static Map<String, Method> toolMethods(Object toolObject) {
        return Arrays.stream(toolObject.getClass().getDeclaredMethods())
                .filter(method -> method.isAnnotationPresent(Tool.class))
                .collect(Collectors.toMap(method -> ToolSpecifications.toolSpecificationFrom(method).name(),
                        Function.identity()));
    }

    public static ToolFanOut none(Executor executor) {
        return new ToolFanOut(Map.of(), List.of(), executor);
    }

    public List<ToolSpecification> specifications() {
        return specifications;
    }

    public boolean isEmpty() {
        return executors.isEmpty();
    }

    /**
     * Executes all requests and returns one result per request, in request order.
     */
    public List<ToolResult> executeAll(List<ToolExecutionRequest> requests, Object memoryId) {
        List<CompletableFuture<ToolResult>> futures = requests.stream()
                .map(request -> CompletableFuture
                        .supplyAsync(() -> execute(request, memoryId), executor)
                        .exceptionally(ex -> failed(request, unwrap(ex))))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private ToolResult execute(ToolExecutionRequest request, Object memoryId) {
        ToolExecutor toolExecutor = executors.get(request.name());
        if (toolExecutor == null) {
            log.warn("Model requested unknown tool '{}'", request.name());
            return ToolResult.failure(request, "Unknown tool: " + request.name());
        }
        log.debug("Executing tool '{}'", request.name());
        return ToolResult.success(request, toolExecutor.execute(request, memoryId));
    }

    private static ToolResult failed(ToolExecutionRequest request, Throwable error) {
        log.warn("Tool '{}' failed: {}", request.name(), error.getMessage());
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ToolResult.failure(request, "Error: " + message);
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    /**
     * Outcome of one tool invocation.
     *
     * @param request the invocation as requested by the model
     * @param text    tool output, or an error description when {@code failed}
     * @param failed  whether the invocation raised an error
     */
    public record ToolResult(ToolExecutionRequest request, String text, boolean failed) {

        public static ToolResult success(ToolExecutionRequest request, String text) {
            return new ToolResult(request, text != null ? text : "", false);
        }

        public static ToolResult failure(ToolExecutionRequest request, String text) {
            return new ToolResult(request, text, true);
        }
    }
}
