package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.AddressData;

/**
 * An address together with the name of the provider that found it.
 */
public record ResolvedAddress(AddressData address, String providerName) {
}
