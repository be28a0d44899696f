package com.payment.facilitator.chain;

import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the adapter for a network by its configured chain family.
 */
@Slf4j
@Component
public class ChainAdapterRegistry {

    private final Map<ChainFamily, ChainAdapter> byFamily = new EnumMap<>(ChainFamily.class);

    public ChainAdapterRegistry(List<ChainAdapter> adapters, NetworkRegistry networkRegistry) {
        for (ChainAdapter adapter : adapters) {
            ChainAdapter previous = byFamily.putIfAbsent(adapter.family(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two chain adapters registered for family " + adapter.family()
                        + ": " + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        log.info("Registered chain adapters: {}", byFamily.keySet());
        for (FacilitatorProperties.Network network : networkRegistry.all()) {
            if (!byFamily.containsKey(network.getFamily())) {
                log.error("Network {} has family {} but no adapter is registered for it", network.getName(), network.getFamily());
            }
        }
    }

    public Optional<ChainAdapter> forFamily(ChainFamily family) {
        return Optional.ofNullable(byFamily.get(family));
    }

    public ChainAdapter forNetwork(FacilitatorProperties.Network network) {
        return forFamily(network.getFamily())
                .filter(adapter -> adapter.supports(network))
                .orElseThrow(() -> new IllegalStateException("No chain adapter for family " + network.getFamily()
                        + " (network " + network.getName() + ")"));
    }
}
