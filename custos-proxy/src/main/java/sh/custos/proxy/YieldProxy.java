// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.custos.core.DebugLogger;
import sh.custos.core.crypto.EcdsaSignatureVerifier;
import sh.custos.core.crypto.SignatureVerifier;
import sh.custos.core.types.Address;
import sh.custos.core.types.Hash;
import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;
import sh.custos.proxy.error.BalanceDecreasedException;
import sh.custos.proxy.error.InvalidSignatureException;
import sh.custos.proxy.error.NothingClaimedException;
import sh.custos.proxy.error.ZeroAddressException;
import sh.custos.proxy.error.ZeroAmountException;
import sh.custos.proxy.event.ProxyEvent;
import sh.custos.proxy.event.ProxyEventListener;
import sh.custos.proxy.event.ProxyEventLog;
import sh.custos.proxy.spi.BundleExecutor;
import sh.custos.proxy.spi.ChainEnvironment;
import sh.custos.proxy.spi.Erc20Token;
import sh.custos.proxy.spi.PermitAuthorization;
import sh.custos.proxy.spi.PermitTransfer;
import sh.custos.proxy.spi.ProxyFactory;

/**
 * Custodial proxy holding one client's assets in an external yield protocol.
 *
 * <p>
 * The factory initializes the proxy and deposits on the client's behalf; the
 * client withdraws and may forward arbitrary allow-listed calls. Realized profit
 * is split between client and treasury by the fee rate fixed at initialization.
 *
 * <p>
 * Every operation takes the calling account explicitly and runs atomically: if
 * any step throws, ledger, events and chain environment are restored and the
 * exception propagates unchanged.
 *
 * <pre>{@code
 * YieldProxy proxy = YieldProxy.builder()
 *         .config(config)
 *         .factory(factory)
 *         .executor(bundler)
 *         .permitTransfer(permit2)
 *         .environment(chain)
 *         .build();
 *
 * proxy.initialize(factoryAddress, client, 8_700);
 * proxy.deposit(factoryAddress, vault, depositCall, permit);
 * WithdrawalSplit split = proxy.withdraw(client, vault, redeemCall, vault, shares);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class YieldProxy {

    private static final Logger log = LoggerFactory.getLogger(YieldProxy.class);

    /** ERC-1271 value returned for a valid signature. */
    public static final Selector ERC1271_MAGIC_VALUE = new Selector("0x1626ba7e");

    /** ERC-165 interface id of {@code supportsInterface(bytes4)}. */
    public static final Selector ERC165_INTERFACE_ID = new Selector("0x01ffc9a7");

    /** ERC-1271 interface id of {@code isValidSignature(bytes32,bytes)}. */
    public static final Selector ERC1271_INTERFACE_ID = ERC1271_MAGIC_VALUE;

    private static final List<String> EXTERNAL_FUNCTIONS = List.of(
            "initialize(address,uint256)",
            "deposit(address,bytes,((address,uint160,uint48,uint48),address,uint256),bytes)",
            "withdraw(address,bytes,address,uint256)",
            "callAnyFunction(address,bytes)",
            "claimReward(address,address,uint256,bytes32[])",
            "checkCalldata(address,bytes4,bytes,uint8)");

    /** Interface id of the proxy: the XOR of its external function selectors. */
    public static final Selector PROXY_INTERFACE_ID = EXTERNAL_FUNCTIONS.stream()
            .map(Selector::of)
            .reduce(Selector::xor)
            .orElseThrow();

    private static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private final ProxyConfig config;
    private final Address self;
    private final ProxyFactory factory;
    private final BundleExecutor executor;
    private final PermitTransfer permitTransfer;
    private final ChainEnvironment environment;
    private final SignatureVerifier signatureVerifier;

    private final ProxyLedger ledger = new ProxyLedger();
    private final ProxyEventLog eventLog = new ProxyEventLog();
    private final FeeSplitEngine feeSplitEngine = new FeeSplitEngine();
    private final ReentrancyGuard reentrancyGuard = new ReentrancyGuard();
    private final AccessController accessController;
    private final CalldataForwarder forwarder;
    private final StateJournal journal;

    private YieldProxy(final Builder builder) {
        this.config = builder.config;
        this.self = config.proxyAddress();
        this.factory = builder.factory;
        this.executor = builder.executor;
        this.permitTransfer = builder.permitTransfer;
        this.environment = builder.environment;
        this.signatureVerifier = builder.signatureVerifier;
        this.accessController = new AccessController(config.factory(), ledger);
        this.forwarder = new CalldataForwarder(environment, self);
        this.journal = new StateJournal(List.of(ledger, eventLog, environment));
        builder.listeners.forEach(eventLog::addListener);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sets the client and fee rate. Callable once, by the factory.
     *
     * @param caller the calling account
     * @param client the client whose assets the proxy holds
     * @param feeBps the client's profit share in basis points, in {@code (0, 10000]}
     * @throws sh.custos.proxy.error.UnauthorizedCallerException  if {@code caller} is not the factory
     * @throws sh.custos.proxy.error.InvalidFeeRateException      if {@code feeBps} is out of range
     * @throws sh.custos.proxy.error.AlreadyInitializedException  on a second call
     * @throws ZeroAddressException                               if {@code client} is zero
     */
    public void initialize(final Address caller, final Address client, final long feeBps) {
        Objects.requireNonNull(client, "client");
        journal.run("initialize", () -> {
            accessController.requireFactory(caller);
            FeeRate rate = FeeRate.of(feeBps);
            ledger.initialize(client, rate);
            eventLog.append(new ProxyEvent.Initialized(client, rate.basisPoints()));
            log.info("proxy {} initialized for client {} at {} bps", self, client, rate.basisPoints());
        });
    }

    /**
     * Pulls the permitted amount from the client and forwards {@code payload} to {@code target}.
     * Factory only; not reentrancy-guarded.
     *
     * @param caller  the calling account
     * @param target  the yield protocol contract
     * @param payload the deposit instruction
     * @param permit  the client's signed permit naming asset and amount
     * @return the forwarded call's return data
     */
    public HexData deposit(
            final Address caller,
            final Address target,
            final HexData payload,
            final PermitAuthorization permit) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(permit, "permit");
        return journal.atomically("deposit", () -> {
            accessController.requireFactory(caller);
            ledger.requireFeeRate("deposit");
            Address asset = permit.token();
            BigInteger amount = permit.amount();
            if (asset.isZero()) {
                throw new ZeroAddressException("asset");
            }
            if (amount.signum() == 0) {
                throw new ZeroAmountException("amount");
            }
            checkForwarded(target, payload, OperationKind.DEPOSIT);

            BigInteger newTotal = ledger.recordDeposit(asset, amount);

            Address client = ledger.client();
            permitTransfer.permit(client, permit);
            permitTransfer.transferFrom(self, client, self, amount, asset);

            Erc20Token token = environment.token(asset);
            if (token.allowance(self, permitTransfer.address()).signum() == 0) {
                token.approve(self, permitTransfer.address(), MAX_UINT256);
            }

            HexData result = forwarder.forward(target, payload);
            eventLog.append(new ProxyEvent.Deposited(target, asset, amount, newTotal));
            log.debug("deposited {} of {} via {}, total {}", amount, asset, target, newTotal);
            return result;
        });
    }

    /**
     * Redeems vault shares through {@code target} and releases the proceeds, minus
     * the treasury's share of newly realized profit, to the client. Client only.
     *
     * @param caller  the calling account
     * @param target  the contract performing the redemption
     * @param payload the withdrawal instruction
     * @param vault   the vault whose shares are redeemed
     * @param shares  number of shares the target may spend
     * @return the applied split
     */
    public WithdrawalSplit withdraw(
            final Address caller,
            final Address target,
            final HexData payload,
            final Address vault,
            final BigInteger shares) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(vault, "vault");
        Objects.requireNonNull(shares, "shares");
        return journal.atomically("withdraw", () -> reentrancyGuard.guard("withdraw", () -> {
            accessController.requireClient(caller);
            checkForwarded(target, payload, OperationKind.WITHDRAWAL);
            if (shares.signum() <= 0) {
                throw new ZeroAmountException("shares");
            }
            FeeRate rate = ledger.requireFeeRate("withdraw");

            Address asset = environment.vault(vault).asset();
            Erc20Token underlying = environment.token(asset);
            environment.token(vault).approve(self, target, shares);

            BigInteger before = underlying.balanceOf(self);
            forwarder.forward(target, payload);
            BigInteger after = underlying.balanceOf(self);
            if (after.compareTo(before) < 0) {
                throw new BalanceDecreasedException(asset, before, after);
            }
            BigInteger released = after.subtract(before);

            WithdrawalSplit split = feeSplitEngine.splitWithdrawal(
                    ledger.deposited(asset), ledger.withdrawn(asset), released, rate);
            ledger.recordWithdrawal(asset, released);

            if (split.feeAmount().signum() > 0) {
                underlying.transfer(self, config.treasury(), split.feeAmount());
            }
            underlying.transfer(self, ledger.client(), split.clientAmount());

            eventLog.append(new ProxyEvent.Withdrawn(target, vault, asset, shares, released,
                    split.withdrawnAfter(), split.newProfit(), split.feeAmount(), split.clientAmount()));
            log.debug("withdrew {} of {} via {}: profit {}, fee {}", released, asset, target,
                    split.newProfit(), split.feeAmount());
            return split;
        }));
    }

    /**
     * Forwards an allow-listed call without touching the ledger. Client only.
     *
     * @return the forwarded call's return data
     */
    public HexData callAnyFunction(final Address caller, final Address target, final HexData payload) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(payload, "payload");
        return journal.atomically("callAnyFunction", () -> reentrancyGuard.guard("callAnyFunction", () -> {
            accessController.requireClient(caller);
            checkForwarded(target, payload, OperationKind.ANY_FUNCTION);
            HexData result = forwarder.forward(target, payload);
            eventLog.append(new ProxyEvent.CalledAsAnyFunction(target));
            return result;
        }));
    }

    /**
     * Claims a merkle-distributed reward through the executor and splits the
     * claimed amount with the flat fee policy.
     *
     * <p>
     * The client may always claim; anyone else must be authorized by the factory.
     *
     * @param caller      the calling account
     * @param distributor the reward distributor
     * @param reward      the reward token
     * @param amount      the claimable amount in the distributor's tree
     * @param proof       the merkle proof
     * @return the applied split
     * @throws NothingClaimedException if the proxy's reward balance did not increase
     */
    public FeeSplit claimReward(
            final Address caller,
            final Address distributor,
            final Address reward,
            final BigInteger amount,
            final List<Hash> proof) {
        Objects.requireNonNull(distributor, "distributor");
        Objects.requireNonNull(reward, "reward");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(proof, "proof");
        return journal.atomically("claimReward", () -> reentrancyGuard.guard("claimReward", () -> {
            FeeRate rate = ledger.requireFeeRate("claimReward");
            Address client = ledger.client();
            if (!accessController.isClient(caller)) {
                factory.checkRewardClaimer(caller, client, distributor);
            }

            Erc20Token token = environment.token(reward);
            BigInteger before = token.balanceOf(self);
            HexData instruction = executor.claimRewardInstruction(distributor, self, reward, amount, proof);
            DebugLogger.logCall("[CLAIM] executor=%s instruction=%s", executor.address(), instruction);
            executor.multicall(self, List.of(instruction));
            BigInteger claimed = token.balanceOf(self).subtract(before);
            if (claimed.signum() <= 0) {
                throw new NothingClaimedException(reward);
            }

            FeeSplit split = feeSplitEngine.splitClaim(claimed, rate);
            if (split.feeAmount().signum() > 0) {
                token.transfer(self, config.treasury(), split.feeAmount());
            }
            token.transfer(self, client, split.clientAmount());

            eventLog.append(new ProxyEvent.ClaimedReward(distributor, reward, claimed,
                    split.feeAmount(), split.clientAmount()));
            log.debug("claimed {} of {} from {}, fee {}", claimed, reward, distributor, split.feeAmount());
            return split;
        }));
    }

    /**
     * Asks the factory's allow-list whether an instruction may be forwarded.
     *
     * @throws sh.custos.proxy.error.CalldataNotAllowedException if it may not
     */
    public void checkCalldata(
            final Address target,
            final Selector selector,
            final HexData remainder,
            final OperationKind kind) {
        factory.checkCalldata(target, selector, remainder, kind);
    }

    /**
     * ERC-1271 signature check: the proxy accepts what its client signed.
     *
     * @param hash      the signed hash
     * @param signature the packed signature
     * @return {@link #ERC1271_MAGIC_VALUE}
     * @throws InvalidSignatureException if the client did not sign {@code hash}
     */
    public Selector validateSignature(final Hash hash, final HexData signature) {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(signature, "signature");
        Address client = journal.read(ledger::client);
        DebugLogger.logSignature("[VERIFY] signer=%s hash=%s signature=%s", client, hash, signature);
        if (!signatureVerifier.isValidSignatureNow(client, hash, signature)) {
            throw new InvalidSignatureException(hash);
        }
        return ERC1271_MAGIC_VALUE;
    }

    /**
     * ERC-165 introspection.
     *
     * @return true for the ERC-165, ERC-1271 and proxy interface ids
     */
    public boolean supportsInterface(final Selector interfaceId) {
        Objects.requireNonNull(interfaceId, "interfaceId");
        return interfaceId.equals(ERC165_INTERFACE_ID)
                || interfaceId.equals(ERC1271_INTERFACE_ID)
                || interfaceId.equals(PROXY_INTERFACE_ID);
    }

    private void checkForwarded(final Address target, final HexData payload, final OperationKind kind) {
        Calldata calldata = Calldata.split(payload);
        factory.checkCalldata(target, calldata.selector(), calldata.remainder(), kind);
    }

    public Address address() {
        return self;
    }

    public Address factory() {
        return config.factory();
    }

    public Address treasury() {
        return config.treasury();
    }

    public Address executor() {
        return config.executor();
    }

    public ProxyConfig config() {
        return config;
    }

    /**
     * @return the client, or the zero address before initialization
     */
    public Address client() {
        return journal.read(ledger::client);
    }

    /**
     * @return the client's fee rate in basis points, or zero before initialization
     */
    public int feeBasisPoints() {
        return journal.read(ledger::feeBasisPoints);
    }

    public ProxyState state() {
        return journal.read(ledger::state);
    }

    public BigInteger totalDeposited(final Address asset) {
        return journal.read(() -> ledger.deposited(asset));
    }

    public BigInteger totalWithdrawn(final Address asset) {
        return journal.read(() -> ledger.withdrawn(asset));
    }

    /**
     * @return {@code max(0, totalWithdrawn - totalDeposited)} of {@code asset}
     */
    public BigInteger realizedProfit(final Address asset) {
        return journal.read(() -> FeeSplitEngine.realizedProfit(ledger.deposited(asset), ledger.withdrawn(asset)));
    }

    /**
     * Computes the split a withdrawal releasing {@code amount} of {@code asset}
     * would get, without changing any state.
     */
    public WithdrawalSplit previewWithdrawal(final Address asset, final BigInteger amount) {
        return journal.read(() -> feeSplitEngine.splitWithdrawal(
                ledger.deposited(asset), ledger.withdrawn(asset), amount, ledger.requireFeeRate("previewWithdrawal")));
    }

    /**
     * @return all events, including those of an operation still in progress
     */
    public List<ProxyEvent> events() {
        return journal.read(eventLog::events);
    }

    public void addListener(final ProxyEventListener listener) {
        eventLog.addListener(listener);
    }

    /**
     * Builder for {@link YieldProxy}.
     */
    public static final class Builder {
        private ProxyConfig config;
        private ProxyFactory factory;
        private BundleExecutor executor;
        private PermitTransfer permitTransfer;
        private ChainEnvironment environment;
        private SignatureVerifier signatureVerifier = new EcdsaSignatureVerifier();
        private final List<ProxyEventListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder config(final ProxyConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder factory(final ProxyFactory factory) {
            this.factory = Objects.requireNonNull(factory, "factory must not be null");
            return this;
        }

        public Builder executor(final BundleExecutor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        public Builder permitTransfer(final PermitTransfer permitTransfer) {
            this.permitTransfer = Objects.requireNonNull(permitTransfer, "permitTransfer must not be null");
            return this;
        }

        public Builder environment(final ChainEnvironment environment) {
            this.environment = Objects.requireNonNull(environment, "environment must not be null");
            return this;
        }

        /**
         * Overrides the ECDSA verifier used by {@link YieldProxy#validateSignature}.
         */
        public Builder signatureVerifier(final SignatureVerifier signatureVerifier) {
            this.signatureVerifier = Objects.requireNonNull(signatureVerifier, "signatureVerifier must not be null");
            return this;
        }

        public Builder listener(final ProxyEventListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /**
         * @throws IllegalStateException    if a collaborator is missing
         * @throws IllegalArgumentException if a collaborator's address disagrees with the config
         */
        public YieldProxy build() {
            requireSet(config, "config");
            requireSet(factory, "factory");
            requireSet(executor, "executor");
            requireSet(permitTransfer, "permitTransfer");
            requireSet(environment, "environment");
            if (!factory.address().equals(config.factory())) {
                throw new IllegalArgumentException("factory " + factory.address()
                        + " does not match configured " + config.factory());
            }
            if (!executor.address().equals(config.executor())) {
                throw new IllegalArgumentException("executor " + executor.address()
                        + " does not match configured " + config.executor());
            }
            return new YieldProxy(this);
        }

        private static void requireSet(final Object value, final String name) {
            if (value == null) {
                throw new IllegalStateException(name + " is required");
            }
        }
    }
}
