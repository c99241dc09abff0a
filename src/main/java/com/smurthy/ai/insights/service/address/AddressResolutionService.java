package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.AddressData;
import com.smurthy.ai.insights.model.OrganizationRecord;
import com.smurthy.ai.insights.repository.HcoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves and caches the postal address of an organization.
 *
 * A fresh cached address is returned without contacting any provider. Otherwise the provider
 * chain is consulted and the first usable address is written back to the store. The website
 * lookup runs on every request, independently of the address.
 */
public class AddressResolutionService {

    private static final Logger log = LoggerFactory.getLogger(AddressResolutionService.class);

    private final HcoRepository hcoRepository;
    private final AddressFreshnessPolicy freshnessPolicy;
    private final CompositeAddressLookupProvider addressProvider;
    private final WebsiteLocator websiteLocator;
    private final Clock clock;

    public AddressResolutionService(HcoRepository hcoRepository,
                                    AddressFreshnessPolicy freshnessPolicy,
                                    CompositeAddressLookupProvider addressProvider,
                                    WebsiteLocator websiteLocator,
                                    Clock clock) {
        this.hcoRepository = hcoRepository;
        this.freshnessPolicy = freshnessPolicy;
        this.addressProvider = addressProvider;
        this.websiteLocator = websiteLocator;
        this.clock = clock;
    }

    public AddressLookupOutcome resolve(String organizationName) {
        log.info("Looking up address for HCO: {}", organizationName);

        Optional<OrganizationRecord> match = hcoRepository.findByName(organizationName);
        if (match.isEmpty()) {
            log.info("No HCO named '{}' in the store", organizationName);
            return AddressLookupOutcome.notFound(organizationName);
        }

        OrganizationRecord hco = match.get();
        OrganizationRecord shown = hco;
        AddressSource source;
        String providerName = null;

        if (freshnessPolicy.isFresh(hco)) {
            log.info("Using cached address for {}", hco.name());
            source = AddressSource.CACHE;
        } else {
            Optional<ResolvedAddress> resolved = addressProvider.lookup(hco.name(), hco.state());
            if (resolved.isPresent()) {
                providerName = resolved.get().providerName();
                shown = writeBack(hco, resolved.get().address());
                source = AddressSource.PROVIDER;
            } else {
                source = hco.hasAddress() ? AddressSource.STALE_CACHE : AddressSource.NONE;
                log.warn("No provider refreshed the address of {}, showing {}", hco.name(), source);
            }
        }

        String website = websiteLocator.findWebsite(hco.name(), hco.state()).orElse(null);
        return new AddressLookupOutcome(organizationName, shown, source, providerName, website);
    }

    private OrganizationRecord writeBack(OrganizationRecord hco, AddressData address) {
        Instant now = clock.instant();
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, HcoRepository.ADDRESS, address.street());
        putIfPresent(fields, HcoRepository.CITY, address.city());
        putIfPresent(fields, HcoRepository.STATE, address.state());
        putIfPresent(fields, HcoRepository.ZIP_CODE, address.zipCode());
        fields.put(HcoRepository.ADDRESS_LAST_UPDATED, now);
        fields.put(HcoRepository.UPDATED_AT, now);

        try {
            if (hcoRepository.updatePartial(hco.id(), fields)) {
                log.info("Successfully updated address for {}", hco.name());
            } else {
                log.warn("Failed to update address in store for {}", hco.name());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to update address in store for {}: {}", hco.name(), e.getMessage());
        }
        return hco.withAddress(address, now);
    }

    private static void putIfPresent(Map<String, Object> fields, String column, String value) {
        if (value != null && !value.isBlank()) {
            fields.put(column, value);
        }
    }
}
