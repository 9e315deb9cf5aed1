package io.specqueue.executor;

public interface TaskExecutor {
    String id();

    ExecutionResult execute(ExecutionRequest request) throws Exception;
}
