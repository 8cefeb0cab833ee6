package com.vidnyan.trustgate.domain.language;

import java.util.Set;

/**
 * Call names that introduce untrusted data (sources) or consume it dangerously (sinks).
 */
public record TaintCatalog(
    Set<String> sources,
    Set<String> sinks
) {

    public TaintCatalog {
        sources = Set.copyOf(sources);
        sinks = Set.copyOf(sinks);
    }

    public static TaintCatalog empty() {
        return new TaintCatalog(Set.of(), Set.of());
    }

    public boolean isSource(String callName) {
        return matches(callName, sources);
    }

    public boolean isSink(String callName) {
        return matches(callName, sinks);
    }

    /**
     * A call matches an entry when its name equals the entry, or when it ends
     * with "." plus the last segment of a dotted entry ({@code flask.request.args}
     * matches {@code request.args}).
     */
    public static boolean matches(String callName, Set<String> entries) {
        if (callName == null || callName.isEmpty()) {
            return false;
        }
        if (entries.contains(callName)) {
            return true;
        }
        for (String entry : entries) {
            int dot = entry.lastIndexOf('.');
            if (dot >= 0 && callName.endsWith(entry.substring(dot))) {
                return true;
            }
        }
        return false;
    }
}
