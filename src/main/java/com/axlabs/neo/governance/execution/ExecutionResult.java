package com.axlabs.neo.governance.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of invoking the intents of a proposal.
 */
public final class ExecutionResult {

    public static final int UNKNOWN_INDEX = -1;

    private final boolean success;
    private final List<Object> returnValues;
    private final int failedIndex;
    private final Object returnData;
    private final String message;

    private ExecutionResult(boolean success, List<Object> returnValues, int failedIndex, Object returnData,
            String message) {
        this.success = success;
        this.returnValues = returnValues;
        this.failedIndex = failedIndex;
        this.returnData = returnData;
        this.message = message;
    }

    public static ExecutionResult success(List<?> returnValues) {
        return new ExecutionResult(true, Collections.unmodifiableList(new ArrayList<>(returnValues)),
                UNKNOWN_INDEX, null, null);
    }

    public static ExecutionResult failure(int failedIndex, String message, Object returnData) {
        return new ExecutionResult(false, Collections.emptyList(), failedIndex, returnData, message);
    }

    public static ExecutionResult failure(String message, Object returnData) {
        return failure(UNKNOWN_INDEX, message, returnData);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return the return value of each intent. Empty on failure.
     */
    public List<Object> getReturnValues() {
        return returnValues;
    }

    /**
     * @return the index of the failing intent, or {@link #UNKNOWN_INDEX} if the gateway cannot tell which one failed.
     */
    public int getFailedIndex() {
        return failedIndex;
    }

    /**
     * @return what was left after a failure. Its type depends on the gateway, e.g., a list of stack items.
     */
    public Object getReturnData() {
        return returnData;
    }

    /**
     * @return the reason of a failure, null on success.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return success ? "ExecutionResult{success, " + returnValues + "}"
                : "ExecutionResult{failure at " + failedIndex + ", " + message + "}";
    }
}
