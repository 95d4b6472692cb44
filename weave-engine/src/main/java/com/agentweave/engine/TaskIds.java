package com.agentweave.engine;

import java.util.UUID;

/** Task ids of the form {@code <prefix>_<12 hex chars>}, e.g. {@code hierarchical_3f2a9c0b1d4e}. */
public final class TaskIds {

    private TaskIds() {
    }

    public static String newTaskId(String prefix) {
        String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        String p = prefix != null && !prefix.isBlank() ? prefix.trim() : "workflow";
        return p + "_" + hex;
    }
}
