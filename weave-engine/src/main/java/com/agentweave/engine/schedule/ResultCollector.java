package com.agentweave.engine.schedule;

import com.agentweave.workflow.model.AgentResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * One write-once slot per subtask, indexed by declaration position. Results can arrive in any
 * order from any thread; {@link #inOrder()} always returns them in declaration order.
 */
public final class ResultCollector {

    private final AtomicReferenceArray<AgentResult> slots;

    public ResultCollector(int size) {
        this.slots = new AtomicReferenceArray<>(size);
    }

    /**
     * Stores the result for the subtask at {@code index}.
     *
     * @return false when the slot was already filled; the first result wins
     */
    public boolean set(int index, AgentResult result) {
        return slots.compareAndSet(index, null, result);
    }

    public boolean has(int index) {
        return slots.get(index) != null;
    }

    public AgentResult get(int index) {
        return slots.get(index);
    }

    public int size() {
        return slots.length();
    }

    public int filledCount() {
        int n = 0;
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) != null) n++;
        }
        return n;
    }

    /** Filled slots in declaration order; empty slots are skipped. */
    public List<AgentResult> inOrder() {
        List<AgentResult> out = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            AgentResult r = slots.get(i);
            if (r != null) out.add(r);
        }
        return out;
    }
}
