package com.axlabs.neo.governance.util;

import com.axlabs.neo.governance.execution.ExecutionGateway;
import com.axlabs.neo.governance.execution.ExecutionResult;
import com.axlabs.neo.governance.proposal.Intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Records invoked methods and returns their names as return values. If any intent calls a method marked as failing,
 * none of the intents is recorded and a failed result for that intent is returned.
 */
public class RecordingGateway implements ExecutionGateway {

    private final List<String> invocations = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failing = Collections.synchronizedSet(new HashSet<>());
    private volatile Runnable onInvoke;

    @Override
    public ExecutionResult invokeAll(List<Intent> intents) {
        if (onInvoke != null) {
            onInvoke.run();
        }
        List<String> methods = new ArrayList<>();
        for (int i = 0; i < intents.size(); i++) {
            String method = intents.get(i).getPayload().getMethod();
            if (failing.contains(method)) {
                return ExecutionResult.failure(i, "ABORT in " + method, "fault");
            }
            methods.add(method);
        }
        invocations.addAll(methods);
        return ExecutionResult.success(methods);
    }

    public void failOn(String method) {
        failing.add(method);
    }

    public void recover(String method) {
        failing.remove(method);
    }

    public void onInvoke(Runnable action) {
        this.onInvoke = action;
    }

    public List<String> getInvocations() {
        return new ArrayList<>(invocations);
    }
}
