package it.pagopa.soapclient.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamespaceSlotTest {

    @Test
    void shouldExposeFifteenSlots() {
        assertEquals(15, NamespaceSlot.values().length);
        assertEquals("tns0", NamespaceSlot.TNS0.getPrefix());
        assertEquals("tns14", NamespaceSlot.TNS14.getPrefix());
    }

    @Test
    void shouldResolveSlotFromKey() {
        assertEquals(Optional.of(NamespaceSlot.TNS7), NamespaceSlot.fromKey("tns7"));
        assertEquals(Optional.of(NamespaceSlot.TNS11), NamespaceSlot.fromKey("tns11"));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(
            strings = {
                    "tns15",
                    "TNS1",
                    "tns",
                    "urn",
                    ""
            }
    )
    void shouldNotResolveUnknownKeys(String key) {
        assertTrue(NamespaceSlot.fromKey(key).isEmpty());
    }
}
