package com.axlabs.neo.governance.execution;

import com.axlabs.neo.governance.proposal.Intent;
import io.neow3j.protocol.Neow3j;
import io.neow3j.protocol.core.response.InvocationResult;
import io.neow3j.protocol.core.response.NeoApplicationLog;
import io.neow3j.protocol.core.response.NeoSendRawTransaction;
import io.neow3j.transaction.AccountSigner;
import io.neow3j.transaction.TransactionBuilder;
import io.neow3j.types.Hash256;
import io.neow3j.types.NeoVMStateType;
import io.neow3j.utils.Await;
import io.neow3j.wallet.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Executes the intents of a proposal as one transaction on a Neo N3 network, signed by the executor account.
 * <p>
 * The script is first test-invoked. Only if the test invocation halts, the transaction is sent. The call blocks
 * until the transaction is included in a block. Since all intents run in one script, a fault reverts all of them.
 */
public class Neow3jExecutionGateway implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(Neow3jExecutionGateway.class);

    private final Neow3j neow3j;
    private final Account executor;

    public Neow3jExecutionGateway(Neow3j neow3j, Account executor) {
        this.neow3j = Objects.requireNonNull(neow3j, "neow3j");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public ExecutionResult invokeAll(List<Intent> intents) {
        byte[] script = IntentScripts.buildScript(executor.getScriptHash(), intents);
        try {
            TransactionBuilder builder = new TransactionBuilder(neow3j)
                    .script(script)
                    .signers(AccountSigner.calledByEntry(executor));

            ExecutionResult testRunFailure = testRunFailure(builder.callInvokeScript().getInvocationResult());
            if (testRunFailure != null) {
                return testRunFailure;
            }

            NeoSendRawTransaction response = builder.sign().send();
            ExecutionResult sendFailure = sendFailure(response);
            if (sendFailure != null) {
                return sendFailure;
            }
            Hash256 txHash = response.getSendRawTransaction().getHash();
            log.debug("Sent transaction {} executing {} intents", txHash, intents.size());
            Await.waitUntilTransactionIsExecuted(txHash, neow3j);

            return toResult(neow3j.getApplicationLog(txHash).send().getApplicationLog().getExecutions().get(0));
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            log.warn("Failed to execute {} intents", intents.size(), t);
            return ExecutionResult.failure(t.getMessage(), null);
        }
    }

    /**
     * @return a failure if the test invocation faulted, null if it halted.
     */
    static ExecutionResult testRunFailure(InvocationResult testRun) {
        if (testRun.hasStateFault()) {
            log.warn("Test invocation faulted: {}", testRun.getException());
            return ExecutionResult.failure(testRun.getException(), testRun.getStack());
        }
        return null;
    }

    /**
     * @return a failure if the node rejected the transaction, null if it accepted it.
     */
    static ExecutionResult sendFailure(NeoSendRawTransaction response) {
        if (response.hasError()) {
            log.warn("Transaction rejected: {}", response.getError().getMessage());
            return ExecutionResult.failure(response.getError().getMessage(), null);
        }
        return null;
    }

    static ExecutionResult toResult(NeoApplicationLog.Execution execution) {
        if (execution.getState().equals(NeoVMStateType.FAULT)) {
            return ExecutionResult.failure(execution.getException(), execution.getStack());
        }
        return ExecutionResult.success(execution.getStack());
    }
}
