package com.axlabs.neo.governance;

import com.axlabs.neo.governance.delegation.Delegation;
import com.axlabs.neo.governance.delegation.DelegationRegistry;
import com.axlabs.neo.governance.delegation.VotingPowerSource;
import com.axlabs.neo.governance.events.GovernanceEvent;
import com.axlabs.neo.governance.events.GovernanceEvent.DelegationChanged;
import com.axlabs.neo.governance.events.GovernanceEvent.ProposalCancelled;
import com.axlabs.neo.governance.events.GovernanceEvent.ProposalCreated;
import com.axlabs.neo.governance.events.GovernanceEvent.ProposalExecuted;
import com.axlabs.neo.governance.events.GovernanceEvent.ProposalQueued;
import com.axlabs.neo.governance.events.GovernanceEvent.ProposalStateChanged;
import com.axlabs.neo.governance.events.GovernanceEvent.VoteCast;
import com.axlabs.neo.governance.events.GovernanceEventListener;
import com.axlabs.neo.governance.execution.ExecutionGateway;
import com.axlabs.neo.governance.execution.ExecutionResult;
import com.axlabs.neo.governance.proposal.CallPayload;
import com.axlabs.neo.governance.proposal.Intent;
import com.axlabs.neo.governance.proposal.Proposal;
import com.axlabs.neo.governance.proposal.ProposalParameters;
import com.axlabs.neo.governance.proposal.ProposalState;
import com.axlabs.neo.governance.proposal.ProposalStore;
import com.axlabs.neo.governance.vote.ReputationSource;
import com.axlabs.neo.governance.vote.VoteChoice;
import com.axlabs.neo.governance.vote.VoteLedger;
import com.axlabs.neo.governance.vote.VoteReceipt;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The governance process. Proposals are created, voted on with delegated voting power, queued once they succeeded
 * and executed after their time lock.
 * <p>
 * States that change with time (pending to active, active to succeeded or defeated, queued to expired) are derived
 * whenever a proposal is looked at. Operations on the same proposal are serialized.
 */
public class GovernanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    private final GovernanceConfig config;
    private final Clock clock;
    private final DelegationRegistry delegations;
    private final VoteLedger votes;
    private final ProposalStore proposals;
    private final ExecutionGateway gateway;

    private final List<GovernanceEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<Integer, ReentrantLock> locks = new ConcurrentHashMap<>();

    public GovernanceEngine(GovernanceConfig config, Clock clock, VotingPowerSource powerSource,
            ExecutionGateway gateway) {
        this(config, clock, powerSource, null, gateway);
    }

    /**
     * @param config           The governance parameters.
     * @param clock            The source of the current time.
     * @param powerSource      The voting power of accounts before delegation.
     * @param reputationSource Used for proposals with reputation weighting. May be null, in which case such
     *                         proposals cannot be created.
     * @param gateway          Carries out the intents of executed proposals.
     */
    public GovernanceEngine(GovernanceConfig config, Clock clock, VotingPowerSource powerSource,
            ReputationSource reputationSource, ExecutionGateway gateway) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.delegations = new DelegationRegistry(Objects.requireNonNull(powerSource, "powerSource"));
        this.votes = new VoteLedger(delegations, reputationSource);
        this.proposals = new ProposalStore(new ProposalStateMachine(votes, config.tallyRule()));
    }

    public GovernanceConfig getConfig() {
        return config;
    }

    public void addListener(GovernanceEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(GovernanceEventListener listener) {
        listeners.remove(listener);
    }

    //region GOVERNANCE PROCESS METHODS

    /**
     * Creates a proposal with the configured default quorum and acceptance rate.
     *
     * @param proposer    The proposer.
     * @param targets     The contracts called if the proposal is executed.
     * @param values      The amounts sent along with the calls.
     * @param payloads    The calls.
     * @param description The description, e.g., the URI of the off-chain discussion.
     * @return the id of the new proposal.
     */
    public int propose(Hash160 proposer, List<Hash160> targets, List<BigInteger> values, List<CallPayload> payloads,
            String description) {
        return propose(proposer, targets, values, payloads, description, config.getMinQuorum(),
                config.getMinAcceptanceRate());
    }

    /**
     * Creates a proposal with its own quorum and acceptance rate. Neither may be lower than the configured minimum.
     *
     * @param proposer       The proposer.
     * @param targets        The contracts called if the proposal is executed.
     * @param values         The amounts sent along with the calls.
     * @param payloads       The calls.
     * @param description    The description, e.g., the URI of the off-chain discussion.
     * @param quorum         The total vote weight necessary.
     * @param acceptanceRate The percentage of approving vote weight necessary.
     * @return the id of the new proposal.
     */
    public int propose(Hash160 proposer, List<Hash160> targets, List<BigInteger> values, List<CallPayload> payloads,
            String description, BigInteger quorum, int acceptanceRate) {

        if (acceptanceRate < config.getMinAcceptanceRate() || acceptanceRate > 100) {
            throw new GovernanceException(GovernanceError.INVALID_PROPOSAL, "GovernanceEngine.propose",
                    "Invalid acceptance rate");
        }
        if (quorum == null || quorum.compareTo(config.getMinQuorum()) < 0) {
            throw new GovernanceException(GovernanceError.INVALID_PROPOSAL, "GovernanceEngine.propose",
                    "Invalid quorum");
        }
        ProposalParameters params = config.defaultProposalParameters().withVoteRules(quorum, acceptanceRate);
        if (!votes.supports(params.getWeightingMode())) {
            throw new GovernanceException(GovernanceError.INVALID_PROPOSAL, "GovernanceEngine.propose",
                    "Weighting mode " + params.getWeightingMode() + " not supported");
        }

        long now = clock.now();
        int id = proposals.create(proposer, targets, values, payloads, description, params, now);
        Proposal p = proposals.get(id);
        log.debug("Created proposal {} by {} with voting from {} to {}", id, proposer, p.getVotingStart(),
                p.getVotingEnd());
        fire(new ProposalCreated(now, id, proposer, p.getVotingStart(), p.getVotingEnd(), p.getQuorum(),
                p.getAcceptanceRate()));
        withLock(id, "propose", () -> observe(id, now));
        return id;
    }

    /**
     * Casts a vote on the proposal with {@code id}. The proposal has to be active and the voter needs voting power
     * at the proposal's snapshot.
     *
     * @param id     The proposal's id.
     * @param voter  The voter.
     * @param choice The vote.
     * @return the weight the vote was counted with.
     */
    public BigInteger vote(int id, Hash160 voter, VoteChoice choice) {
        return withLock(id, "vote", () -> {
            long now = clock.now();
            ProposalState state = observe(id, now);
            if (state != ProposalState.ACTIVE) {
                throw new GovernanceException(GovernanceError.VOTING_NOT_OPEN, "GovernanceEngine.vote",
                        "Proposal " + id + " is " + state + ", not ACTIVE");
            }
            BigInteger weight = votes.castVote(proposals.get(id), voter, choice, now);
            log.debug("{} voted {} on proposal {} with weight {}", voter, choice, id, weight);
            fire(new VoteCast(now, id, voter, choice, weight));
            return weight;
        });
    }

    /**
     * Casts a vote given by its numeric code: -1 to reject, 1 to approve, 0 to abstain.
     */
    public BigInteger vote(int id, Hash160 voter, int vote) {
        return vote(id, voter, VoteChoice.fromCode(vote));
    }

    public ProposalState state(int id) {
        return withLock(id, "state", () -> observe(id, clock.now()));
    }

    /**
     * Resolves the outcome of a proposal whose voting has closed.
     *
     * @param id The proposal's id.
     * @return the proposal's state, i.e., succeeded or defeated, or any later state.
     */
    public ProposalState finalize(int id) {
        return withLock(id, "finalize", () -> {
            ProposalState state = observe(id, clock.now());
            if (state == ProposalState.PENDING || state == ProposalState.ACTIVE) {
                throw new GovernanceException(GovernanceError.VOTING_NOT_CLOSED, "GovernanceEngine.finalize",
                        "Proposal " + id + " is " + state);
            }
            log.debug("Proposal {} finalized as {}", id, state);
            return state;
        });
    }

    /**
     * Queues a succeeded proposal. It can be executed once its time lock has passed.
     *
     * @param id     The proposal's id.
     * @param caller The account queuing the proposal.
     * @return the earliest time of execution.
     */
    public long queue(int id, Hash160 caller) {
        requireAllowed(config.getQueuers(), caller, "GovernanceEngine.queue");
        return withLock(id, "queue", () -> {
            long now = clock.now();
            ProposalState state = observe(id, now);
            if (state == ProposalState.EXECUTED) {
                throw new GovernanceException(GovernanceError.ALREADY_EXECUTED, "GovernanceEngine.queue");
            }
            if (state == ProposalState.PENDING || state == ProposalState.ACTIVE) {
                throw new GovernanceException(GovernanceError.VOTING_NOT_CLOSED, "GovernanceEngine.queue",
                        "Proposal " + id + " is " + state);
            }
            Proposal p = proposals.transition(id, ProposalState.SUCCEEDED, ProposalState.QUEUED, now);
            log.debug("Proposal {} queued by {}, executable from {}", id, caller, p.getExecuteAfter());
            fire(new ProposalStateChanged(now, id, ProposalState.SUCCEEDED, ProposalState.QUEUED));
            fire(new ProposalQueued(now, id, caller, p.getExecuteAfter()));
            return p.getExecuteAfter();
        });
    }

    /**
     * Executes the intents of a queued proposal in order, as one unit through the gateway. If an intent fails, no
     * intent takes effect, a {@link TargetCallFailedException} is thrown and the proposal stays queued.
     *
     * @param id     The proposal's id.
     * @param caller The account executing the proposal.
     * @return the return data of each intent.
     */
    public List<Object> execute(int id, Hash160 caller) {
        requireAllowed(config.getExecutors(), caller, "GovernanceEngine.execute");
        ReentrantLock lock = lockOf(id, "execute");
        if (lock.isHeldByCurrentThread()) {
            throw new GovernanceException(GovernanceError.ILLEGAL_TRANSITION, "GovernanceEngine.execute",
                    "Proposal " + id + " is already being executed");
        }
        lock.lock();
        try {
            long now = clock.now();
            ProposalState state = observe(id, now);
            Proposal p = proposals.get(id);
            if (state == ProposalState.EXECUTED) {
                throw new GovernanceException(GovernanceError.ALREADY_EXECUTED, "GovernanceEngine.execute");
            }
            if (state == ProposalState.EXPIRED) {
                throw new GovernanceException(GovernanceError.PROPOSAL_EXPIRED, "GovernanceEngine.execute");
            }
            if (state != ProposalState.QUEUED) {
                throw new GovernanceException(GovernanceError.ILLEGAL_TRANSITION, "GovernanceEngine.execute",
                        "Proposal " + id + " is " + state + ", not QUEUED");
            }
            if (now < p.getExecuteAfter()) {
                throw new GovernanceException(GovernanceError.TIMELOCK_NOT_ELAPSED, "GovernanceEngine.execute",
                        "Proposal " + id + " is executable from " + p.getExecuteAfter());
            }

            List<Object> returnData = invokeAll(id, p.getIntents());
            proposals.transition(id, ProposalState.QUEUED, ProposalState.EXECUTED, now);
            log.debug("Proposal {} executed by {}", id, caller);
            fire(new ProposalStateChanged(now, id, ProposalState.QUEUED, ProposalState.EXECUTED));
            fire(new ProposalExecuted(now, id, caller));
            return returnData;
        } finally {
            lock.unlock();
        }
    }

    private List<Object> invokeAll(int id, List<Intent> intents) {
        ExecutionResult result;
        try {
            result = gateway.invokeAll(intents);
        } catch (RuntimeException e) {
            log.warn("Execution of proposal {} threw", id, e);
            TargetCallFailedException failure = new TargetCallFailedException(id, ExecutionResult.UNKNOWN_INDEX,
                    null, e.getMessage());
            failure.initCause(e);
            throw failure;
        }
        if (!result.isSuccess()) {
            log.warn("Execution of proposal {} failed at intent {}: {}", id, result.getFailedIndex(),
                    result.getMessage());
            throw new TargetCallFailedException(id, result.getFailedIndex(), result.getReturnData(),
                    result.getMessage());
        }
        return new ArrayList<>(result.getReturnValues());
    }

    /**
     * Cancels a proposal that is still pending or active. Only the proposer and the configured cancellers can do
     * this.
     *
     * @param id     The proposal's id.
     * @param caller The account cancelling the proposal.
     */
    public void cancel(int id, Hash160 caller) {
        Objects.requireNonNull(caller, "caller");
        withLock(id, "cancel", () -> {
            long now = clock.now();
            Proposal p = proposals.get(id);
            if (!p.getProposer().equals(caller) && !config.getCancellers().contains(caller)) {
                log.warn("{} tried to cancel proposal {}", caller, id);
                throw new GovernanceException(GovernanceError.NOT_AUTHORIZED, "GovernanceEngine.cancel");
            }
            ProposalState state = observe(id, now);
            if (state == ProposalState.EXECUTED) {
                throw new GovernanceException(GovernanceError.ALREADY_EXECUTED, "GovernanceEngine.cancel");
            }
            if (state != ProposalState.PENDING && state != ProposalState.ACTIVE) {
                throw new GovernanceException(GovernanceError.ILLEGAL_TRANSITION, "GovernanceEngine.cancel",
                        "Proposal " + id + " is " + state);
            }
            proposals.transition(id, state, ProposalState.CANCELLED, now);
            log.debug("Proposal {} cancelled by {}", id, caller);
            fire(new ProposalStateChanged(now, id, state, ProposalState.CANCELLED));
            fire(new ProposalCancelled(now, id, caller));
            return null;
        });
    }
    // endregion GOVERNANCE PROCESS METHODS

    //region DELEGATION

    /**
     * Delegates {@code amount} of the voting power of {@code from} to {@code to}. Only affects proposals whose
     * snapshot lies after this point in time.
     *
     * @return the delegation from {@code from} to {@code to} after the change.
     */
    public Delegation delegate(Hash160 from, Hash160 to, BigInteger amount) {
        long now = clock.now();
        Delegation d = delegations.delegate(from, to, amount, now);
        log.debug("{} delegated {} to {}", from, amount, to);
        fire(new DelegationChanged(now, from, to, d.getAmount(), delegations.powerOf(to, now)));
        return d;
    }

    /**
     * Takes back {@code amount} of the voting power {@code from} delegated to {@code to}.
     *
     * @return the remaining delegation from {@code from} to {@code to}.
     */
    public Delegation revoke(Hash160 from, Hash160 to, BigInteger amount) {
        long now = clock.now();
        Delegation d = delegations.revoke(from, to, amount, now);
        log.debug("{} revoked {} from {}", from, amount, to);
        fire(new DelegationChanged(now, from, to, d.getAmount(), delegations.powerOf(to, now)));
        return d;
    }

    public DelegationRegistry getDelegations() {
        return delegations;
    }
    // endregion DELEGATION

    //region GETTERS

    public BigInteger getVotingPower(Hash160 account) {
        return getVotingPower(account, clock.now());
    }

    /**
     * @return the voting power of {@code account} at {@code snapshot}, including power delegated to it and
     * excluding power it delegated away.
     */
    public BigInteger getVotingPower(Hash160 account, long snapshot) {
        return delegations.powerOf(account, snapshot);
    }

    public VoteReceipt getReceipt(int id, Hash160 voter) {
        proposals.get(id);
        return votes.receiptOf(id, voter);
    }

    public boolean hasVoted(int id, Hash160 voter) {
        return proposals.exists(id) && votes.hasVoted(id, voter);
    }

    /**
     * Gets the proposal with {@code id}, including its votes and its current state.
     *
     * @param id The proposal's id.
     * @return the proposal.
     */
    public ProposalDTO getProposal(int id) {
        return withLock(id, "getProposal", () -> {
            ProposalState state = observe(id, clock.now());
            return new ProposalDTO(proposals.get(id), votes.votesOf(id), state);
        });
    }

    /**
     * Gets the number of all proposals created so far.
     *
     * @return the number of proposals.
     */
    public int getProposalCount() {
        return proposals.count();
    }

    /**
     * Gets the proposals on the given page.
     *
     * @param page         The page.
     * @param itemsPerPage The number of proposals per page.
     * @return the page.
     */
    public Paginator.Paginated<ProposalDTO> getProposals(int page, int itemsPerPage) {
        int n = proposals.count();
        int[] pagination = Paginator.calcPagination(n, page, itemsPerPage);
        List<ProposalDTO> list = new ArrayList<>();
        for (int i = pagination[0]; i < pagination[1]; i++) {
            list.add(getProposal(i));
        }
        return new Paginator.Paginated<>(page, pagination[2], list);
    }
    // endregion GETTERS

    private ProposalState observe(int id, long now) {
        ProposalState state = proposals.state(id, now);
        ProposalState previous = proposals.observe(id, state);
        if (previous != null) {
            log.debug("Proposal {} moved from {} to {}", id, previous, state);
            fire(new ProposalStateChanged(now, id, previous, state));
        }
        return state;
    }

    private static void requireAllowed(Set<Hash160> allowed, Hash160 caller, String method) {
        Objects.requireNonNull(caller, "caller");
        if (!allowed.isEmpty() && !allowed.contains(caller)) {
            log.warn("{} is not allowed to call {}", caller, method);
            throw new GovernanceException(GovernanceError.NOT_AUTHORIZED, method);
        }
    }

    private ReentrantLock lockOf(int id, String method) {
        if (!proposals.exists(id)) {
            throw new GovernanceException(GovernanceError.NOT_FOUND, "GovernanceEngine." + method,
                    "Proposal " + id + " doesn't exist");
        }
        return locks.computeIfAbsent(id, k -> new ReentrantLock());
    }

    private <T> T withLock(int id, String method, Operation<T> operation) {
        ReentrantLock lock = lockOf(id, method);
        lock.lock();
        try {
            return operation.run();
        } catch (GovernanceException e) {
            log.warn("{} on proposal {} failed: {}", method, id, e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private void fire(GovernanceEvent event) {
        for (GovernanceEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {}", listener, event.getName(), e);
            }
        }
    }

    @FunctionalInterface
    private interface Operation<T> {
        T run();
    }
}
