package com.axlabs.neo.governance.execution;

import com.axlabs.neo.governance.proposal.CallPayload;
import com.axlabs.neo.governance.proposal.Intent;
import io.neow3j.contract.GasToken;
import io.neow3j.script.ScriptBuilder;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static com.axlabs.neo.governance.util.TestHelper.ALICE;
import static com.axlabs.neo.governance.util.TestHelper.TREASURY;
import static com.axlabs.neo.governance.util.TestHelper.releaseCall;
import static io.neow3j.types.ContractParameter.any;
import static io.neow3j.types.ContractParameter.hash160;
import static io.neow3j.types.ContractParameter.integer;
import static io.neow3j.utils.Numeric.reverseHexString;
import static io.neow3j.utils.Numeric.toHexStringNoPrefix;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.singletonList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

public class IntentScriptsTest {

    @Test
    public void succeed_building_call_without_params() {
        Intent intent = new Intent(TREASURY, BigInteger.ZERO, CallPayload.call("execute"));
        String expected = "c2" // NEWARRAY0
                + "1f" // CallFlags.ALL
                + "0c07" + toHexStringNoPrefix("execute".getBytes(UTF_8))
                + "0c14" + reverseHexString(TREASURY.toString())
                + "41627d5b52"; // System.Contract.Call

        assertThat(toHexStringNoPrefix(IntentScripts.buildCallScript(intent)), is(expected));
        assertThat(toHexStringNoPrefix(IntentScripts.buildScript(ALICE, singletonList(intent))), is(expected));
    }

    @Test
    public void succeed_building_call_with_params() {
        Intent intent = new Intent(TREASURY, BigInteger.ZERO, releaseCall(ALICE, 5));
        String expected = "15" // 5
                + "0c14" + reverseHexString(ALICE.toString())
                + "12c0" // pack 2 params
                + "1f"
                + "0c0d" + toHexStringNoPrefix("releaseTokens".getBytes(UTF_8))
                + "0c14" + reverseHexString(TREASURY.toString())
                + "41627d5b52";

        assertThat(toHexStringNoPrefix(IntentScripts.buildCallScript(intent)), is(expected));
    }

    @Test
    public void succeed_building_script_with_gas_transfer() {
        Intent intent = new Intent(TREASURY, BigInteger.valueOf(100), CallPayload.call("execute"));
        byte[] transfer = new ScriptBuilder().contractCall(GasToken.SCRIPT_HASH, IntentScripts.TRANSFER,
                Arrays.asList(hash160(ALICE), hash160(TREASURY), integer(100), any(null))).toArray();

        String expected = toHexStringNoPrefix(transfer)
                + "39" // ASSERT
                + toHexStringNoPrefix(IntentScripts.buildCallScript(intent));
        assertThat(toHexStringNoPrefix(IntentScripts.buildScript(ALICE, singletonList(intent))), is(expected));
    }

    @Test
    public void succeed_building_one_script_for_all_intents() {
        Intent transfer = new Intent(TREASURY, BigInteger.valueOf(100), CallPayload.call("execute"));
        Intent release = new Intent(TREASURY, BigInteger.ZERO, releaseCall(ALICE, 5));

        String expected = toHexStringNoPrefix(IntentScripts.buildScript(ALICE, singletonList(transfer)))
                + toHexStringNoPrefix(IntentScripts.buildCallScript(release));
        assertThat(toHexStringNoPrefix(IntentScripts.buildScript(ALICE, Arrays.asList(transfer, release))),
                is(expected));
    }
}
