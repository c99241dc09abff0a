package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.AddressData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeAddressLookupProviderTest {

    private static final AddressData TYRONE = new AddressData("187 Hospital Drive", "Tyrone", "PA", "16686");

    private ProviderHealthTracker healthTracker;

    @BeforeEach
    void setUp() {
        healthTracker = new ProviderHealthTracker();
    }

    @Test
    @DisplayName("Should try providers in priority order, not registration order")
    void testPriorityOrder() {
        // Given
        FakeProvider webSearch = new FakeProvider("Web Search", 2, true, () -> Optional.of(TYRONE));
        FakeProvider registry = new FakeProvider("CMS Registry", 1, true, () -> Optional.of(TYRONE));
        CompositeAddressLookupProvider composite =
                new CompositeAddressLookupProvider(List.of(webSearch, registry), healthTracker);

        // When
        Optional<ResolvedAddress> resolved = composite.lookup("Tyrone Hospital", "PA");

        // Then
        assertThat(resolved).contains(new ResolvedAddress(TYRONE, "CMS Registry"));
        assertThat(composite.getProviders()).containsExactly(registry, webSearch);
        assertThat(webSearch.calls).isZero();
        assertThat(healthTracker.getStats("CMS Registry").getSuccessCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should move to the next provider when one throws")
    void testFailureFallsThrough() {
        FakeProvider registry = new FakeProvider("CMS Registry", 1, true, () -> {
            throw new IllegalStateException("503 Service Unavailable");
        });
        FakeProvider webSearch = new FakeProvider("Web Search", 2, true, () -> Optional.of(TYRONE));
        CompositeAddressLookupProvider composite =
                new CompositeAddressLookupProvider(List.of(registry, webSearch), healthTracker);

        assertThat(composite.lookup("Tyrone Hospital", "PA")).contains(new ResolvedAddress(TYRONE, "Web Search"));

        ProviderHealthTracker.ProviderStats stats = healthTracker.getStats("CMS Registry");
        assertThat(stats.getFailureCount()).isEqualTo(1);
        assertThat(stats.getLastFailureReason()).isEqualTo("503 Service Unavailable");
        assertThat(registry.calls).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat an address without city as a miss")
    void testUnusableAddressIsMiss() {
        FakeProvider registry = new FakeProvider("CMS Registry", 1, true,
                () -> Optional.of(new AddressData("187 Hospital Drive", null, "PA", "16686")));
        FakeProvider webSearch = new FakeProvider("Web Search", 2, true, Optional::empty);
        CompositeAddressLookupProvider composite =
                new CompositeAddressLookupProvider(List.of(registry, webSearch), healthTracker);

        assertThat(composite.lookup("Tyrone Hospital", "PA")).isEmpty();
        assertThat(healthTracker.getStats("CMS Registry").getMissCount()).isEqualTo(1);
        assertThat(healthTracker.getStats("Web Search").getMissCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip disabled providers")
    void testDisabledSkipped() {
        FakeProvider registry = new FakeProvider("CMS Registry", 1, false, () -> Optional.of(TYRONE));
        FakeProvider webSearch = new FakeProvider("Web Search", 2, true, () -> Optional.of(TYRONE));
        CompositeAddressLookupProvider composite =
                new CompositeAddressLookupProvider(List.of(registry, webSearch), healthTracker);

        assertThat(composite.lookup("Tyrone Hospital", "PA"))
                .map(ResolvedAddress::providerName)
                .contains("Web Search");
        assertThat(registry.calls).isZero();
    }

    private static final class FakeProvider implements AddressLookupProvider {
        private final String name;
        private final int priority;
        private final boolean enabled;
        private final Supplier<Optional<AddressData>> answer;
        private int calls;

        FakeProvider(String name, int priority, boolean enabled, Supplier<Optional<AddressData>> answer) {
            this.name = name;
            this.priority = priority;
            this.enabled = enabled;
            this.answer = answer;
        }

        @Override
        public Optional<AddressData> lookup(String organizationName, String state) {
            calls++;
            return answer.get();
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public String getProviderName() {
            return name;
        }

        @Override
        public int getPriority() {
            return priority;
        }
    }
}
