package com.axlabs.neo.governance.proposal;

import io.neow3j.crypto.Hash;
import io.neow3j.script.ScriptBuilder;
import io.neow3j.types.Hash256;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Hashes proposals by their content. Two proposals with the same intents and description get the same hash.
 */
public class ProposalHasher {

    private ProposalHasher() {
    }

    public static byte[] hashDescription(String description) {
        return Hash.sha256(description.getBytes(UTF_8));
    }

    /**
     * Calculates the SHA-256 hash of the concatenation of all intents followed by the description hash. Each intent
     * contributes its target (little-endian), its value and the script of its contract call, the latter two
     * prefixed with their length.
     *
     * @param intents         The intents.
     * @param descriptionHash The hash of the proposal's description.
     * @return the proposal hash.
     */
    public static Hash256 hashProposal(List<Intent> intents, byte[] descriptionHash) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (Intent intent : intents) {
            CallPayload payload = intent.getPayload();
            byte[] callScript = new ScriptBuilder()
                    .contractCall(intent.getTarget(), payload.getMethod(), payload.getParams(),
                            payload.getCallFlags())
                    .toArray();
            bytes.writeBytes(intent.getTarget().toLittleEndianArray());
            bytes.writeBytes(lengthPrefixed(intent.getValue().toByteArray()));
            bytes.writeBytes(lengthPrefixed(callScript));
        }
        bytes.writeBytes(descriptionHash);
        return new Hash256(Hash.sha256(bytes.toByteArray()));
    }

    private static byte[] lengthPrefixed(byte[] data) {
        return ByteBuffer.allocate(4 + data.length).putInt(data.length).put(data).array();
    }
}
