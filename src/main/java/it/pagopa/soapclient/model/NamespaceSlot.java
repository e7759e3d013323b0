package it.pagopa.soapclient.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fifteen additional namespace declarations an envelope can carry, from {@code tns0} to
 * {@code tns14}. The set is closed: slot keys outside of it are not representable.
 */
public enum NamespaceSlot {
    TNS0,
    TNS1,
    TNS2,
    TNS3,
    TNS4,
    TNS5,
    TNS6,
    TNS7,
    TNS8,
    TNS9,
    TNS10,
    TNS11,
    TNS12,
    TNS13,
    TNS14;

    private static final Map<String, NamespaceSlot> lookupMap = Arrays.stream(values())
            .collect(Collectors.toMap(NamespaceSlot::getPrefix, Function.identity()));

    /**
     * @return the namespace prefix bound by this slot, e.g. {@code tns7}
     */
    public String getPrefix() {
        return name().toLowerCase();
    }

    /**
     * Resolve a slot from its configuration key. Keys are matched exactly.
     *
     * @param key the slot key, e.g. {@code tns7}
     * @return the slot, or empty for an unrecognized key
     */
    public static Optional<NamespaceSlot> fromKey(String key) {
        return Optional.ofNullable(key).map(lookupMap::get);
    }
}
