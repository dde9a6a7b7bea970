package org.Aayush.sparse.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BackingStoreCatalog Tests")
class BackingStoreCatalogTest {

    @Test
    @DisplayName("Default catalog exposes built-ins and the ordered default")
    void testDefaultCatalogShape() {
        BackingStoreCatalog catalog = BackingStoreCatalog.defaultCatalog();

        assertNotNull(catalog.defaultFactory());
        assertEquals(BackingStoreCatalog.STORE_ORDERED, catalog.defaultFactory().id());
        assertNotNull(catalog.factory(BackingStoreCatalog.STORE_ORDERED));
        assertNotNull(catalog.factory(BackingStoreCatalog.STORE_ORDERED_AVL));
        assertNotNull(catalog.factory(BackingStoreCatalog.STORE_HASHED));
        assertNull(catalog.factory(null));
        assertNull(catalog.factory("ordered"));
        assertEquals(3, catalog.storeIds().size());
    }

    @Test
    @DisplayName("Built-in factories create empty stores of their family")
    void testBuiltInFactoriesCreateEmptyStores() {
        BackingStoreCatalog catalog = BackingStoreCatalog.defaultCatalog();
        for (String id : catalog.storeIds()) {
            BackingStore<Integer> store = catalog.factory(id).create(32);
            assertTrue(store.isEmpty());
            assertEquals(id, store.id());
        }
    }

    @Test
    @DisplayName("Custom factory can override built-in by id")
    void testCustomFactoryOverrideBuiltIn() {
        BackingStoreFactory override = new FixedFactory(BackingStoreCatalog.STORE_HASHED);
        BackingStoreCatalog catalog = new BackingStoreCatalog(List.of(override));

        assertSame(override, catalog.factory(BackingStoreCatalog.STORE_HASHED));
        assertNotNull(catalog.factory(BackingStoreCatalog.STORE_ORDERED));
    }

    @Test
    @DisplayName("Null custom factory collection keeps built-in catalog shape")
    void testNullCustomFactoriesFallBackToBuiltIns() {
        BackingStoreCatalog catalog = new BackingStoreCatalog((Collection<? extends BackingStoreFactory>) null);

        assertEquals(3, catalog.storeIds().size());
        assertEquals(BackingStoreCatalog.STORE_ORDERED, catalog.defaultFactory().id());
    }

    @Test
    @DisplayName("Explicit constructor rejects missing default id")
    void testExplicitCatalogRejectsMissingDefault() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new BackingStoreCatalog("MISSING", List.of(new FixedFactory("X")))
        );
    }

    @Test
    @DisplayName("Catalog constructors reject blank ids and null factory entries")
    void testCatalogRejectsBlankIdsAndNullFactories() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new BackingStoreCatalog("   ", List.of(new FixedFactory("X")))
        );
        assertThrows(
                IllegalArgumentException.class,
                () -> new BackingStoreCatalog("X", List.of(new FixedFactory("   ")))
        );
        assertThrows(
                NullPointerException.class,
                () -> new BackingStoreCatalog(Arrays.asList((BackingStoreFactory) null))
        );
    }

    private record FixedFactory(String id) implements BackingStoreFactory {
        @Override
        public <V> BackingStore<V> create(int expectedSize) {
            return SortedMapBackingStore.redBlackTree();
        }
    }
}
