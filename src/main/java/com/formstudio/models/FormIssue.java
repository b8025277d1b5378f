package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A structural problem found while parsing. Issues are reported, never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormIssue {

    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info");

        private final String wireName;

        Severity(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }

    private final Severity severity;
    private final String message;
    private final Integer line;

    public FormIssue(Severity severity, String message, Integer line) {
        this.severity = severity;
        this.message = message;
        this.line = line;
    }

    public static FormIssue error(String message, Integer line) {
        return new FormIssue(Severity.ERROR, message, line);
    }

    public static FormIssue warning(String message, Integer line) {
        return new FormIssue(Severity.WARNING, message, line);
    }

    public static FormIssue info(String message, Integer line) {
        return new FormIssue(Severity.INFO, message, line);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Integer getLine() {
        return line;
    }
}
