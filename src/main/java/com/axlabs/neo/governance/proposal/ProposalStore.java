package com.axlabs.neo.governance.proposal;

import com.axlabs.neo.governance.GovernanceError;
import com.axlabs.neo.governance.GovernanceException;
import io.neow3j.contract.ContractManagement;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds all proposals.
 * <p>
 * Creation is synchronized on the store. Transitions of a proposal must be serialized by the caller per proposal
 * id.
 */
public class ProposalStore {

    private final ProposalStateResolver resolver;
    private final Map<Integer, Proposal> proposals = new ConcurrentHashMap<>();
    // [proposal hash: id of the latest proposal with that hash]
    private final Map<Hash256, Integer> proposalHashes = new ConcurrentHashMap<>();

    public ProposalStore(ProposalStateResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Creates a proposal. Its voting starts {@code params.getVotingDelay()} after {@code now} and lasts
     * {@code params.getVotingPeriod()}.
     *
     * @param proposer    The account set as the proposer.
     * @param targets     The contracts to call if the proposal is accepted.
     * @param values      The amounts sent along with each call.
     * @param payloads    The calls. Together with {@code targets} and {@code values} they form the intents.
     * @param description The description, e.g., the URI of the off-chain discussion.
     * @param params      The rules for this proposal.
     * @param now         The creation time.
     * @return the id of the proposal.
     */
    public synchronized int create(Hash160 proposer, List<Hash160> targets, List<BigInteger> values,
            List<CallPayload> payloads, String description, ProposalParameters params, long now) {

        if (proposer == null) {
            fail("Missing proposer");
        }
        if (targets == null || values == null || payloads == null || targets.isEmpty()
                || targets.size() != values.size() || targets.size() != payloads.size()) {
            fail("Intents are empty or of different length");
        }
        if (description == null || description.isEmpty()) {
            fail("Empty description");
        }
        if (params == null || params.getVotingDelay() < 0 || params.getVotingPeriod() < 0
                || params.getTimelockLength() < 0 || params.getExpirationLength() < 0) {
            fail("Invalid phase lengths");
        }
        if (!fitsTimeRange(now, params)) {
            fail("Phase lengths exceed the time range");
        }
        if (params.getAcceptanceRate() <= 0 || params.getAcceptanceRate() > 100) {
            fail("Invalid acceptance rate");
        }
        if (params.getQuorum() == null || params.getQuorum().signum() < 0) {
            fail("Invalid quorum");
        }
        if (params.getWeightingMode() == null) {
            fail("Missing weighting mode");
        }
        List<Intent> intents = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            intents.add(new Intent(targets.get(i), values.get(i), payloads.get(i)));
        }
        if (containsCallsToContractManagement(intents)) {
            fail("Calls to ContractManagement not allowed");
        }
        if (!areIntentsValid(intents)) {
            fail("Invalid intents");
        }

        byte[] descriptionHash = ProposalHasher.hashDescription(description);
        Hash256 proposalHash = ProposalHasher.hashProposal(intents, descriptionHash);
        Integer existing = proposalHashes.get(proposalHash);
        if (existing != null) {
            ProposalState state = resolver.resolve(proposals.get(existing), now);
            if (state == ProposalState.PENDING || state == ProposalState.ACTIVE) {
                throw new GovernanceException(GovernanceError.DUPLICATE_PROPOSAL, "ProposalStore.create",
                        "Proposal already pending or active with id " + existing);
            }
        }

        int id = proposals.size();
        proposals.put(id, new Proposal(id, proposer, intents, description, descriptionHash, proposalHash, now,
                params));
        proposalHashes.put(proposalHash, id);
        return id;
    }

    // The latest point in time a proposal can have is its expiration when queued right after voting ended.
    private static boolean fitsTimeRange(long now, ProposalParameters params) {
        try {
            long votingEnd = Math.addExact(Math.addExact(now, params.getVotingDelay()), params.getVotingPeriod());
            Math.addExact(Math.addExact(votingEnd, params.getTimelockLength()), params.getExpirationLength());
            return true;
        } catch (ArithmeticException e) {
            return false;
        }
    }

    private static boolean areIntentsValid(List<Intent> intents) {
        for (Intent intent : intents) {
            CallPayload payload = intent.getPayload();
            if (intent.getTarget() == null ||
                    intent.getTarget().equals(Hash160.ZERO) ||
                    intent.getValue() == null ||
                    intent.getValue().signum() < 0 ||
                    payload == null ||
                    payload.getMethod() == null ||
                    payload.getMethod().isEmpty() ||
                    payload.getCallFlags() == null
            ) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsCallsToContractManagement(List<Intent> intents) {
        for (Intent i : intents) {
            if (ContractManagement.SCRIPT_HASH.equals(i.getTarget())) {
                return true;
            }
        }
        return false;
    }

    private static void fail(String reason) {
        throw new GovernanceException(GovernanceError.INVALID_PROPOSAL, "ProposalStore.create", reason);
    }

    /**
     * Gets the proposal with {@code id}.
     *
     * @param id The proposal's id.
     * @return the proposal.
     */
    public Proposal get(int id) {
        Proposal proposal = proposals.get(id);
        if (proposal == null) {
            throw new GovernanceException(GovernanceError.NOT_FOUND, "ProposalStore.get",
                    "Proposal " + id + " doesn't exist");
        }
        return proposal;
    }

    public boolean exists(int id) {
        return proposals.containsKey(id);
    }

    /**
     * @return the number of proposals created so far. Ids range from zero to this number minus one.
     */
    public int count() {
        return proposals.size();
    }

    public ProposalState state(int id, long now) {
        return resolver.resolve(get(id), now);
    }

    /**
     * Moves the proposal with {@code id} from state {@code from} to state {@code to}.
     * <p>
     * Allowed are {@code SUCCEEDED -> QUEUED}, {@code QUEUED -> EXECUTED} and {@code PENDING|ACTIVE -> CANCELLED}.
     *
     * @param id   The proposal's id.
     * @param from The state the caller saw the proposal in.
     * @param to   The new state.
     * @param now  The time of the transition.
     * @return the updated proposal.
     */
    public Proposal transition(int id, ProposalState from, ProposalState to, long now) {
        Proposal proposal = get(id);
        ProposalState current = resolver.resolve(proposal, now);
        if (current != from) {
            throw new GovernanceException(GovernanceError.ILLEGAL_TRANSITION, "ProposalStore.transition",
                    "Proposal " + id + " is " + current + ", not " + from);
        }
        if (to == ProposalState.QUEUED && from == ProposalState.SUCCEEDED) {
            proposal.markQueued(now);
        } else if (to == ProposalState.EXECUTED && from == ProposalState.QUEUED) {
            proposal.markExecuted(now);
        } else if (to == ProposalState.CANCELLED
                && (from == ProposalState.PENDING || from == ProposalState.ACTIVE)) {
            proposal.markCancelled();
        } else {
            throw new GovernanceException(GovernanceError.ILLEGAL_TRANSITION, "ProposalStore.transition",
                    "Cannot move proposal " + id + " from " + from + " to " + to);
        }
        proposal.observe(to);
        return proposal;
    }

    /**
     * Records that the proposal was seen in {@code state}.
     *
     * @return the state it was seen in before, if that differs from {@code state}. Null otherwise.
     */
    public ProposalState observe(int id, ProposalState state) {
        ProposalState previous = get(id).observe(state);
        return previous == state ? null : previous;
    }
}
