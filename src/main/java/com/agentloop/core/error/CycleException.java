package com.agentloop.core.error;

import java.util.List;

public class CycleException extends GraphIntegrityException {

    private final List<String> path;

    public CycleException(String nodeId, List<String> path) {
        super("Adding node '" + nodeId + "' would create a dependency cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    public List<String> getPath() {
        return path;
    }
}
