package com.health.checker.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.health.checker.core.model.Checker;
import com.health.checker.core.model.CheckerFailure;
import com.health.checker.core.model.CheckerRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Renders subjects and bodies of escalation messages.
 */
public class NotificationRenderer {
    private static final Logger log = LoggerFactory.getLogger(NotificationRenderer.class);

    private final NotificationSettings settings;
    private final ObjectMapper objectMapper;

    public NotificationRenderer(NotificationSettings settings) {
        this.settings = settings;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String errorSubject(Checker checker) {
        return "Error while running " + checker.getName();
    }

    /**
     * Returns the stored stack trace of an errored run, or a placeholder when none was captured.
     */
    public String errorBody(CheckerRun run) {
        String trace = run.exceptionTrace();
        return trace != null ? trace : "(no exception captured)";
    }

    public String failureSubject(CheckerFailure failure) {
        return failure.text();
    }

    public String failureBody(Checker checker, CheckerFailure failure) {
        StringBuilder body = new StringBuilder();
        if (!failure.subtext().isEmpty()) {
            body.append(failure.subtext()).append("\n\n");
        }
        body.append("Checker: ").append(checker.getName()).append('\n');
        if (failure.hasData()) {
            body.append("Data:\n").append(renderData(failure.data())).append('\n');
        }
        body.append('\n').append(settings.runUrl(checker.getName(), failure.checkerRunId())).append('\n');
        return body.toString();
    }

    public String successSubject(Checker checker) {
        return checker.getName() + " is now succeeding";
    }

    public String successBody(Checker checker) {
        return checker.getName() + " is passing again.\n\n" + settings.checkerUrl(checker.getName()) + "\n";
    }

    String renderData(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Failed to render failure data: {}", e.getMessage());
            return String.valueOf(data);
        }
    }
}
