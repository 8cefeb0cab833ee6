package com.vidnyan.trustgate.domain.rule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.trustgate.domain.meta.MetaNode;

/**
 * One diagnostic emitted by a rule.
 * Immutable value object. The triggering node is only kept while rules run;
 * findings placed in a report are {@link #detached()}.
 */
@JsonPropertyOrder({"rule", "message", "severity", "line", "column", "end_line", "end_column", "fix_hint"})
public record Finding(
    @JsonProperty("rule") String ruleId,
    String message,
    Severity severity,
    int line,
    int column,
    @JsonProperty("end_line") int endLine,
    @JsonProperty("end_column") int endColumn,
    @JsonProperty("fix_hint") String fixHint,
    @JsonIgnore MetaNode node
) {

    /**
     * Copy without the node reference.
     */
    public Finding detached() {
        if (node == null) {
            return this;
        }
        return new Finding(ruleId, message, severity, line, column, endLine, endColumn, fixHint, null);
    }

    public boolean is(Severity expected) {
        return severity == expected;
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String message;
        private Severity severity = Severity.ERROR;
        private int line;
        private int column;
        private int endLine;
        private int endColumn;
        private String fixHint;
        private MetaNode node;

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder column(int column) { this.column = column; return this; }
        public Builder endLine(int endLine) { this.endLine = endLine; return this; }
        public Builder endColumn(int endColumn) { this.endColumn = endColumn; return this; }
        public Builder fixHint(String hint) { this.fixHint = hint; return this; }

        /**
         * Locate the finding at a node and keep the node as its trigger.
         */
        public Builder at(MetaNode node) {
            this.node = node;
            this.line = node.line();
            this.column = node.column();
            return this;
        }

        /**
         * Like {@link #at(MetaNode)} but also records the end position.
         */
        public Builder spanning(MetaNode node) {
            at(node);
            this.endLine = node.endLine();
            this.endColumn = node.endColumn();
            return this;
        }

        public Finding build() {
            return new Finding(ruleId, message, severity, line, column, endLine, endColumn, fixHint, node);
        }
    }
}
