package com.payment.facilitator.config;

import com.payment.facilitator.domain.ChainFamily;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Network definitions and the settlement cache under {@code facilitator.*}. Scalar tuning
 * knobs (intervals, topics) are read with {@code @Value} where they are used.
 */
@Data
@ConfigurationProperties(prefix = "facilitator")
public class FacilitatorProperties {

    /** x402 protocol version accepted in payment headers. */
    private int protocolVersion = 1;

    private List<Network> networks = new ArrayList<>();

    private Cache cache = new Cache();

    @Data
    public static class Cache {

        /** How long a final settle response stays in Redis. */
        private Duration ttl = Duration.ofHours(24);

        /** Prepended to every cache key; change it to share one Redis between deployments. */
        private String keyPrefix = "facilitator:settlement:";
    }

    @Data
    public static class Network {

        /** Name used on the wire, e.g. "base-sepolia". */
        private String name;

        private ChainFamily family;

        /** EVM chain id; informational for Ed25519 networks. */
        private long chainId;

        private String rpcUrl;

        /** Confirmations after which a transaction counts as final on this network. */
        private int requiredConfirmations = 1;

        /**
         * Facilitator signing key: 0x-prefixed secp256k1 private key for EVM,
         * base58 64-byte keypair for Ed25519.
         */
        private String facilitatorKey;

        /** EVM gas limit for one transferWithAuthorization call. */
        private BigInteger gasLimit = BigInteger.valueOf(100_000);

        /** Percentage applied to the node's gas price quote, e.g. 120 = +20%. */
        private int gasPricePercent = 120;

        /** Ed25519: fee per signature in lamports. */
        private BigInteger lamportsPerSignature = BigInteger.valueOf(5_000);

        /** Ed25519: on-chain program that executes signed authorizations. */
        private String settlementProgram;

        private int rpcTimeoutMs = 10_000;

        /** Assets keyed by contract/mint address. */
        private Map<String, Asset> assets = new HashMap<>();

        /** Asset entry for a contract/mint address, compared the way the family compares addresses. */
        public Asset findAsset(String address) {
            Asset exact = assets.get(address);
            if (exact != null || family == null) {
                return exact;
            }
            return assets.entrySet().stream()
                    .filter(e -> family.sameAddress(e.getKey(), address))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
    }

    @Data
    public static class Asset {

        /** EIP-712 domain name of the token contract, e.g. "USD Coin". */
        private String name;

        /** EIP-712 domain version, e.g. "2". */
        private String version;

        private int decimals = 6;
    }
}
