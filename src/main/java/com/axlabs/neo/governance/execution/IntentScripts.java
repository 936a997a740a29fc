package com.axlabs.neo.governance.execution;

import com.axlabs.neo.governance.proposal.CallPayload;
import com.axlabs.neo.governance.proposal.Intent;
import io.neow3j.contract.GasToken;
import io.neow3j.script.OpCode;
import io.neow3j.script.ScriptBuilder;
import io.neow3j.types.Hash160;

import java.util.Arrays;
import java.util.List;

import static io.neow3j.types.ContractParameter.any;
import static io.neow3j.types.ContractParameter.hash160;
import static io.neow3j.types.ContractParameter.integer;

/**
 * Builds the NeoVM scripts for intents.
 */
public class IntentScripts {

    static final String TRANSFER = "transfer";

    private IntentScripts() {
    }

    /**
     * Builds the script of the contract call of the intent, without any value transfer.
     *
     * @param intent The intent.
     * @return the script.
     */
    public static byte[] buildCallScript(Intent intent) {
        return appendCall(new ScriptBuilder(), intent.getTarget(), intent.getPayload()).toArray();
    }

    /**
     * Builds one script executing all intents in order on behalf of {@code sender}.
     * <p>
     * If an intent carries a value, its part first transfers that amount of GAS from the sender to the target and
     * aborts if the transfer returns false. The contract call follows. Each contract call leaves its return value on
     * the stack. A fault anywhere in the script reverts the effects of all intents.
     *
     * @param sender  The account paying the values.
     * @param intents The intents.
     * @return the script.
     */
    public static byte[] buildScript(Hash160 sender, List<Intent> intents) {
        ScriptBuilder b = new ScriptBuilder();
        for (Intent intent : intents) {
            if (intent.getValue().signum() > 0) {
                b.contractCall(GasToken.SCRIPT_HASH, TRANSFER, Arrays.asList(
                        hash160(sender), hash160(intent.getTarget()), integer(intent.getValue()), any(null)));
                b.opCode(OpCode.ASSERT);
            }
            appendCall(b, intent.getTarget(), intent.getPayload());
        }
        return b.toArray();
    }

    private static ScriptBuilder appendCall(ScriptBuilder b, Hash160 target, CallPayload payload) {
        return b.contractCall(target, payload.getMethod(), payload.getParams(), payload.getCallFlags());
    }
}
