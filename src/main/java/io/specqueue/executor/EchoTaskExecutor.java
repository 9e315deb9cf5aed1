package io.specqueue.executor;

import io.specqueue.util.Jsons;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class EchoTaskExecutor implements TaskExecutor {
    @Override
    public String id() {
        return "echo";
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) {
        Map<String, Object> echoed = new LinkedHashMap<>();
        echoed.put("executor", id());
        echoed.put("timestamp", Instant.now().toString());
        echoed.put("taskId", request.taskId());
        echoed.put("sourceId", request.sourceId());
        echoed.put("specPath", String.valueOf(request.specPath()));
        echoed.put("attempt", request.attempt());
        echoed.put("payloadChars", request.payload() == null ? 0 : request.payload().length());
        return ExecutionResult.ok(Jsons.toJson(echoed));
    }
}
