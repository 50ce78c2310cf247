package com.newsdigest.news.api;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.newsdigest.news.status.StatusService;
import com.newsdigest.news.task.TaskSupervisor;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * GET /api/status and GET /api/tasks.
 */
public class StatusHandler extends ApiHandlerBase {

    private final StatusService statusService;
    private final TaskSupervisor supervisor;

    public StatusHandler(StatusService statusService, TaskSupervisor supervisor) {
        this.statusService = statusService;
        this.supervisor = supervisor;
    }

    public void handleStatus(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!checkMethod(exchange, "GET")) return;

        sendObject(exchange, 200, statusService.snapshot());
    }

    public void handleTasks(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!checkMethod(exchange, "GET")) return;

        ArrayNode tasks = mapper.createArrayNode();
        supervisor.list().forEach(task -> tasks.add(taskJson(task)));
        sendObject(exchange, 200, tasks);
    }
}
