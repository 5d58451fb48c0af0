package com.sealedstore.crypto;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SymmetricKeyTest {

    @Test
    void keysWithTheSameBytesAreEqual() {
        SymmetricKey key = SymmetricKey.random();
        SymmetricKey twin = SymmetricKey.fromBytes(key.exportBytes());

        assertEquals(key, twin);
        assertEquals(key.hashCode(), twin.hashCode());
        assertNotEquals(key, SymmetricKey.random());
    }

    @Test
    void hashCodeDoesNotChangeWhenTheKeyIsDestroyed() {
        SymmetricKey key = SymmetricKey.random();
        Set<SymmetricKey> held = new HashSet<>();
        held.add(key);
        int before = key.hashCode();

        key.destroy();

        assertEquals(before, key.hashCode());
        assertTrue(held.remove(key), "A destroyed key can still be removed from a hash set");
    }

    @Test
    void destroyedKeyOnlyEqualsItself() {
        SymmetricKey key = SymmetricKey.random();
        SymmetricKey twin = SymmetricKey.fromBytes(key.exportBytes());
        SymmetricKey other = SymmetricKey.random();

        key.destroy();
        other.destroy();

        assertEquals(key, key);
        assertNotEquals(key, twin);
        assertNotEquals(twin, key);
        assertNotEquals(key, other, "Two zeroed keys are not equal");
    }

    @Test
    void exportAfterDestroyIsRejected() {
        SymmetricKey key = SymmetricKey.random();
        key.close();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, key::exportBytes);
    }
}
