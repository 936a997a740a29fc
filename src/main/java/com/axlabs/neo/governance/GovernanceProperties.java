package com.axlabs.neo.governance;

import com.axlabs.neo.governance.vote.WeightingMode;
import io.neow3j.types.Hash160;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.Properties;
import java.util.function.Consumer;

import static com.axlabs.neo.governance.GovernanceConfig.ABSTAIN_IN_APPROVAL_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.CANCELLERS_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.EXECUTORS_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.EXPIRATION_LENGTH_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.MIN_ACCEPTANCE_RATE_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.MIN_QUORUM_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.QUEUERS_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.TIMELOCK_LENGTH_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.VOTING_DELAY_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.VOTING_LENGTH_KEY;
import static com.axlabs.neo.governance.GovernanceConfig.WEIGHTING_KEY;

/**
 * Reads a {@link GovernanceConfig} from a properties file on the classpath. Missing properties keep the builder's
 * defaults. Accounts are given as comma separated lists of script hashes or addresses, e.g.:
 * <pre>
 *  voting_len=600000
 *  timelock_len=300000
 *  min_accept_rate=50
 *  min_quorum=1000
 *  cancellers=NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PBP,0x69ecca587293047be4c59159bf8bc399985c160d
 * </pre>
 */
public class GovernanceProperties {

    public static final String PROPS_FILE = "governance.properties";

    private final Properties props;

    public GovernanceProperties(Properties props) {
        this.props = props;
    }

    /**
     * Loads {@value #PROPS_FILE} from the classpath.
     */
    public static GovernanceProperties load() {
        return load(PROPS_FILE);
    }

    public static GovernanceProperties load(String resource) {
        Properties props = new Properties();
        try (InputStream in = GovernanceProperties.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Properties file " + resource + " not found on classpath");
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new GovernanceProperties(props);
    }

    public String getProperty(String name) {
        String value = props.getProperty(name);
        return value == null ? null : value.trim();
    }

    public long getLongProperty(String name) {
        return Long.parseLong(getProperty(name));
    }

    public boolean has(String name) {
        String value = getProperty(name);
        return value != null && !value.isEmpty();
    }

    public GovernanceConfig toConfig() {
        GovernanceConfig.Builder b = GovernanceConfig.builder();
        if (has(VOTING_DELAY_KEY)) b.votingDelay(getLongProperty(VOTING_DELAY_KEY));
        if (has(VOTING_LENGTH_KEY)) b.votingPeriod(getLongProperty(VOTING_LENGTH_KEY));
        if (has(TIMELOCK_LENGTH_KEY)) b.timelockLength(getLongProperty(TIMELOCK_LENGTH_KEY));
        if (has(EXPIRATION_LENGTH_KEY)) b.expirationLength(getLongProperty(EXPIRATION_LENGTH_KEY));
        if (has(MIN_ACCEPTANCE_RATE_KEY)) {
            long rate = getLongProperty(MIN_ACCEPTANCE_RATE_KEY);
            GovernanceConfig.throwOnInvalidValue(MIN_ACCEPTANCE_RATE_KEY, rate);
            b.minAcceptanceRate((int) rate);
        }
        if (has(MIN_QUORUM_KEY)) b.minQuorum(new BigInteger(getProperty(MIN_QUORUM_KEY)));
        if (has(WEIGHTING_KEY)) b.weightingMode(WeightingMode.fromName(getProperty(WEIGHTING_KEY)));
        if (has(ABSTAIN_IN_APPROVAL_KEY)) {
            b.abstainCountsTowardApproval(Boolean.parseBoolean(getProperty(ABSTAIN_IN_APPROVAL_KEY)));
        }
        readAccounts(CANCELLERS_KEY, b::canceller);
        readAccounts(QUEUERS_KEY, b::queuer);
        readAccounts(EXECUTORS_KEY, b::executor);
        return b.build();
    }

    private void readAccounts(String key, Consumer<Hash160> sink) {
        if (!has(key)) {
            return;
        }
        for (String account : getProperty(key).split(",")) {
            String s = account.trim();
            if (!s.isEmpty()) {
                sink.accept(parseAccount(s));
            }
        }
    }

    /**
     * Parses a script hash ({@code 0x}-prefixed or 40 hex characters) or an address.
     */
    static Hash160 parseAccount(String account) {
        if (account.startsWith("0x") || account.length() == 40) {
            return new Hash160(account);
        }
        return Hash160.fromAddress(account);
    }
}
