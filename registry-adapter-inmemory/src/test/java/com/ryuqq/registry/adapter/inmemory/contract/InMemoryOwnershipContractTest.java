package com.ryuqq.registry.adapter.inmemory.contract;

import com.ryuqq.registry.adapter.inmemory.bus.InMemoryEventBus;
import com.ryuqq.registry.adapter.inmemory.store.InMemoryRegistryStore;
import com.ryuqq.registry.core.spi.EventBus;
import com.ryuqq.registry.core.spi.RegistryStore;
import com.ryuqq.registry.testkit.contract.OwnershipContract;

/**
 * {@link OwnershipContract} against {@link InMemoryRegistryStore} and {@link InMemoryEventBus}.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class InMemoryOwnershipContractTest extends OwnershipContract {

    @Override
    protected RegistryStore newStore() {
        return new InMemoryRegistryStore();
    }

    @Override
    protected EventBus newEventBus() {
        return new InMemoryEventBus();
    }
}
