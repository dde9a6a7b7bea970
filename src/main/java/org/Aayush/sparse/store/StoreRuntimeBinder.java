package org.Aayush.sparse.store;

import it.unimi.dsi.fastutil.Hash;
import lombok.Builder;
import lombok.Value;
import org.Aayush.sparse.core.MatrixContractException;

import java.util.Objects;

/**
 * Construction-time binder from {@link StoreRuntimeConfig} to a store factory.
 */
public final class StoreRuntimeBinder {

    public static final String REASON_STORE_CONFIG_REQUIRED = "SM_STORE_CONFIG_REQUIRED";
    public static final String REASON_UNKNOWN_STORE = "SM_UNKNOWN_STORE";
    public static final String REASON_EXPECTED_SIZE_INVALID = "SM_EXPECTED_SIZE_INVALID";

    /**
     * Resolves one runtime config into an immutable store binding.
     *
     * @param runtimeConfig store config selected at construction time.
     * @param storeCatalog store family catalog.
     * @return immutable binding able to create fresh stores.
     */
    public Binding bind(StoreRuntimeConfig runtimeConfig, BackingStoreCatalog storeCatalog) {
        if (runtimeConfig == null) {
            throw new MatrixContractException(
                    REASON_STORE_CONFIG_REQUIRED,
                    "storeRuntimeConfig must be provided"
            );
        }
        BackingStoreCatalog nonNullCatalog = Objects.requireNonNull(storeCatalog, "storeCatalog");
        BackingStoreFactory factory = resolveFactory(runtimeConfig.getStoreId(), nonNullCatalog);
        return Binding.builder()
                .factory(factory)
                .expectedSize(resolveExpectedSize(runtimeConfig.getExpectedSize()))
                .build();
    }

    private static BackingStoreFactory resolveFactory(String storeId, BackingStoreCatalog catalog) {
        // unset id selects the catalog default
        if (storeId == null) {
            return catalog.defaultFactory();
        }
        String normalized = normalizeRequiredId(storeId);
        BackingStoreFactory factory = catalog.factory(normalized);
        if (factory == null) {
            throw new MatrixContractException(
                    REASON_UNKNOWN_STORE,
                    "unknown backing store id: " + normalized
            );
        }
        return factory;
    }

    private static int resolveExpectedSize(Integer expectedSize) {
        if (expectedSize == null) {
            return Hash.DEFAULT_INITIAL_SIZE;
        }
        if (expectedSize < 0) {
            throw new MatrixContractException(
                    REASON_EXPECTED_SIZE_INVALID,
                    "expectedSize must be >= 0, got " + expectedSize
            );
        }
        return expectedSize;
    }

    private static String normalizeRequiredId(String id) {
        String normalized = id.trim();
        if (normalized.isEmpty()) {
            throw new MatrixContractException(
                    REASON_STORE_CONFIG_REQUIRED,
                    "storeId must be non-blank when set"
            );
        }
        return normalized;
    }

    /**
     * Immutable runtime binding result.
     */
    @Value
    @Builder
    public static class Binding {
        BackingStoreFactory factory;
        int expectedSize;

        /**
         * Creates a fresh empty store of the bound family.
         */
        public <V> BackingStore<V> newStore() {
            return factory.create(expectedSize);
        }
    }
}
