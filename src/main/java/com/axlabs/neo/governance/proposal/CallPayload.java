package com.axlabs.neo.governance.proposal;

import io.neow3j.types.CallFlags;
import io.neow3j.types.ContractParameter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What to call on an intent's target: the method, its parameters and the call flags to invoke it with.
 */
public final class CallPayload {

    private final String method;
    private final List<ContractParameter> params;
    private final CallFlags callFlags;

    public CallPayload(String method, List<ContractParameter> params, CallFlags callFlags) {
        this.method = method;
        this.params = params == null ? Collections.emptyList() : Collections.unmodifiableList(params);
        this.callFlags = callFlags;
    }

    /**
     * Creates a payload calling {@code method} with all call flags.
     */
    public static CallPayload call(String method, ContractParameter... params) {
        return new CallPayload(method, Arrays.asList(params), CallFlags.ALL);
    }

    public String getMethod() {
        return method;
    }

    public List<ContractParameter> getParams() {
        return params;
    }

    public CallFlags getCallFlags() {
        return callFlags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallPayload)) return false;
        CallPayload that = (CallPayload) o;
        return Objects.equals(method, that.method) && params.equals(that.params) && callFlags == that.callFlags;
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, params, callFlags);
    }

    @Override
    public String toString() {
        return method + "(" + params.size() + " params, " + callFlags + ")";
    }
}
