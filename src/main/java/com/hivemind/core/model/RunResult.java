package com.hivemind.core.model;

/**
 * Outcome of {@code RunEngine.run}. Never thrown, always returned.
 *
 * @param processingTime elapsed inference time in seconds
 */
public record RunResult(
    RunStatus status,
    String agentId,
    String taskId,
    String projectId,
    String memoryTraceId,
    String resultText,
    String format,
    double processingTime,
    String memoryId,
    String message
) {

    public static RunResult success(RunRequest request, String resultText, String format,
                                    double processingTime, String memoryId) {
        return new RunResult(RunStatus.SUCCESS, request.agentId(), request.taskId(), request.projectId(),
                request.memoryTraceId(), resultText, format, processingTime, memoryId,
                "Agent " + request.agentId() + " completed the task");
    }

    public static RunResult error(RunRequest request, String message) {
        return new RunResult(RunStatus.ERROR, request.agentId(), request.taskId(), request.projectId(),
                request.memoryTraceId(), null, null, 0.0, null, message);
    }

    public static RunResult notFound(RunRequest request) {
        return new RunResult(RunStatus.NOT_FOUND, request.agentId(), request.taskId(), request.projectId(),
                request.memoryTraceId(), null, null, 0.0, null,
                "Agent with ID '" + request.agentId() + "' not found");
    }

    public boolean succeeded() {
        return status == RunStatus.SUCCESS;
    }
}
