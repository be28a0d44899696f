package com.payment.facilitator.registry;

import com.payment.facilitator.chain.NetworkRegistry;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PaymentScheme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Requirements declared by resource servers, keyed by {@code (resource, scheme, network)}.
 * Entries are immutable values; re-declaring the same key replaces the entry atomically.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequirementRegistry {

    private final NetworkRegistry networkRegistry;
    private final Map<String, Map<String, PaymentRequirement>> byResource = new ConcurrentHashMap<>();

    public PaymentRequirement declare(PaymentRequirement requirement) {
        validate(requirement);
        byResource.computeIfAbsent(requirement.getResource(), r -> new ConcurrentHashMap<>())
                .put(entryKey(requirement.getScheme(), requirement.getNetwork()), requirement);
        log.info("Declared requirement resource={} scheme={} network={} maxAmountRequired={}",
                requirement.getResource(), requirement.getScheme(), requirement.getNetwork(), requirement.getMaxAmountRequired());
        return requirement;
    }

    /**
     * All requirements for a resource on one network (one per scheme).
     */
    public List<PaymentRequirement> lookup(String resource, String network) {
        return lookup(resource).stream()
                .filter(r -> r.getNetwork().equals(network))
                .collect(Collectors.toList());
    }

    /**
     * All requirements for a resource, across networks.
     */
    public List<PaymentRequirement> lookup(String resource) {
        Map<String, PaymentRequirement> entries = resource == null ? null : byResource.get(resource);
        if (entries == null) {
            return List.of();
        }
        List<PaymentRequirement> result = new ArrayList<>(entries.values());
        result.sort(Comparator.comparing(PaymentRequirement::getNetwork).thenComparing(PaymentRequirement::getScheme));
        return result;
    }

    public Collection<PaymentRequirement> all() {
        return byResource.values().stream()
                .flatMap(m -> m.values().stream())
                .collect(Collectors.toList());
    }

    private void validate(PaymentRequirement requirement) {
        if (requirement == null) {
            throw new InvalidRequirementException("Requirement is required");
        }
        if (requirement.getScheme() == null) {
            throw new InvalidRequirementException("scheme is required");
        }
        if (requirement.getResource() == null || requirement.getResource().isBlank()) {
            throw new InvalidRequirementException("resource is required");
        }
        BigInteger max = requirement.getMaxAmountRequired();
        if (max == null || max.signum() <= 0) {
            throw new InvalidRequirementException("maxAmountRequired must be greater than zero");
        }
        if (requirement.getMaxTimeoutSeconds() <= 0) {
            throw new InvalidRequirementException("maxTimeoutSeconds must be greater than zero");
        }
        FacilitatorProperties.Network network = networkRegistry.find(requirement.getNetwork())
                .orElseThrow(() -> new InvalidRequirementException("Unsupported network: " + requirement.getNetwork()));
        if (!network.getFamily().isValidAddress(requirement.getPayToAddress())) {
            throw new InvalidRequirementException("payToAddress " + requirement.getPayToAddress()
                    + " is not a valid " + network.getFamily() + " address");
        }
        if (!network.getFamily().isValidAddress(requirement.getAsset())) {
            throw new InvalidRequirementException("asset " + requirement.getAsset()
                    + " is not a valid " + network.getFamily() + " address");
        }
    }

    private static String entryKey(PaymentScheme scheme, String network) {
        return scheme.name() + "@" + network;
    }
}
