package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.AddressData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Tries address providers in priority order and returns the first usable address.
 *
 * A provider that throws is treated as having found nothing; the next provider is tried.
 * Calls are never retried.
 */
public class CompositeAddressLookupProvider {

    private static final Logger log = LoggerFactory.getLogger(CompositeAddressLookupProvider.class);
    private final List<AddressLookupProvider> providers;
    private final ProviderHealthTracker healthTracker;

    public CompositeAddressLookupProvider(List<AddressLookupProvider> providers, ProviderHealthTracker healthTracker) {
        this.providers = providers.stream()
                .sorted(Comparator.comparingInt(AddressLookupProvider::getPriority))
                .toList();
        this.healthTracker = healthTracker;
        log.info("Initialized CompositeAddressLookupProvider with {} providers in order: {}",
                this.providers.size(), this.providers.stream().map(AddressLookupProvider::getProviderName).toList());
    }

    public Optional<ResolvedAddress> lookup(String organizationName, String state) {
        for (AddressLookupProvider provider : providers) {
            if (!provider.isEnabled()) {
                log.debug("Skipping disabled provider: {}", provider.getProviderName());
                continue;
            }

            Optional<AddressData> result = tryProvider(provider, organizationName, state);
            if (result.isPresent()) {
                return Optional.of(new ResolvedAddress(result.get(), provider.getProviderName()));
            }
        }

        log.warn("No provider found an address for '{}'", organizationName);
        return Optional.empty();
    }

    private Optional<AddressData> tryProvider(AddressLookupProvider provider, String organizationName, String state) {
        String providerName = provider.getProviderName();

        try {
            log.debug("Trying provider: {} for '{}'", providerName, organizationName);
            Optional<AddressData> address = provider.lookup(organizationName, state).filter(AddressData::isUsable);

            if (address.isPresent()) {
                log.info("SUCCESS: {} returned address for '{}': {}", providerName, organizationName, address.get());
                healthTracker.recordSuccess(providerName);
            } else {
                log.info("MISS: {} found no address for '{}', trying next provider", providerName, organizationName);
                healthTracker.recordMiss(providerName);
            }
            return address;

        } catch (Exception e) {
            log.warn("EXCEPTION: {} failed for '{}': {}", providerName, organizationName, e.getMessage());
            healthTracker.recordFailure(providerName, e.getMessage());
            return Optional.empty();
        }
    }

    // This method is for inspection and testing purposes.
    public List<AddressLookupProvider> getProviders() {
        return this.providers;
    }
}
