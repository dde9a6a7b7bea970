package org.Aayush.sparse.store;

import lombok.Builder;
import lombok.Value;

/**
 * Construction-time backing-store selection for a sparse matrix.
 *
 * <p>This is the only configuration surface of a matrix: which store family
 * holds its entries, and how many entries to pre-size for.</p>
 */
@Value
@Builder
public class StoreRuntimeConfig {

    /**
     * Selected store family id (for example {@code ORDERED} or {@code HASHED}),
     * or {@code null} for the catalog's default family.
     */
    String storeId;

    /**
     * Expected entry count, or {@code null} for the family default.
     */
    Integer expectedSize;

    /**
     * Returns convenience config for the red-black tree store.
     */
    public static StoreRuntimeConfig orderedRuntime() {
        return StoreRuntimeConfig.builder()
                .storeId(BackingStoreCatalog.STORE_ORDERED)
                .build();
    }

    /**
     * Returns convenience config for the hash store pre-sized to {@code expectedSize}.
     */
    public static StoreRuntimeConfig hashedRuntime(int expectedSize) {
        return StoreRuntimeConfig.builder()
                .storeId(BackingStoreCatalog.STORE_HASHED)
                .expectedSize(expectedSize)
                .build();
    }
}
