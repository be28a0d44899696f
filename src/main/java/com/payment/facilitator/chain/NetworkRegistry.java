package com.payment.facilitator.chain;

import com.payment.facilitator.config.FacilitatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Networks this facilitator can settle on, as configured under {@code facilitator.networks}.
 */
@Slf4j
@Component
public class NetworkRegistry {

    private final Map<String, FacilitatorProperties.Network> networks;

    public NetworkRegistry(FacilitatorProperties properties) {
        Map<String, FacilitatorProperties.Network> byName = new LinkedHashMap<>();
        for (FacilitatorProperties.Network network : properties.getNetworks()) {
            if (network.getName() == null || network.getFamily() == null) {
                throw new IllegalStateException("Network configuration requires name and family: " + network);
            }
            if (byName.putIfAbsent(network.getName(), network) != null) {
                throw new IllegalStateException("Duplicate network configuration: " + network.getName());
            }
        }
        this.networks = Collections.unmodifiableMap(byName);
        log.info("Configured networks: {}", networks.keySet());
    }

    public Optional<FacilitatorProperties.Network> find(String name) {
        return Optional.ofNullable(name).map(networks::get);
    }

    public FacilitatorProperties.Network require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unsupported network: " + name));
    }

    public Collection<FacilitatorProperties.Network> all() {
        return networks.values();
    }
}
