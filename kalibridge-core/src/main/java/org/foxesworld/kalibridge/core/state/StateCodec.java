package org.foxesworld.kalibridge.core.state;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Packs one value index per property into a single non-negative int.
 *
 * <p>Layout: properties are laid out in declaration order from the least significant bit up,
 * each taking {@code ceil(log2(domainSize))} bits (0 bits for a single-value domain).
 * For {@code [bool("powered"), intRange("power", 0, 15)]} the state {@code powered=true, power=5}
 * encodes to {@code 1 | (5 << 1) = 11}.</p>
 *
 * <p>The encoded int carries no names or domains; decoding needs the same descriptor list.</p>
 */
public final class StateCodec {

    public static final StateCodec EMPTY = new StateCodec(List.of());

    private static final int MAX_BITS = 31;

    private final List<PropertyDescriptor> properties;
    private final int[] bits;
    private final int[] offsets;
    private final int totalBits;

    public StateCodec(List<? extends PropertyDescriptor> properties) {
        Objects.requireNonNull(properties, "properties");
        this.properties = List.copyOf(properties);

        Set<String> names = new HashSet<>();
        int n = this.properties.size();
        this.bits = new int[n];
        this.offsets = new int[n];

        int shift = 0;
        for (int i = 0; i < n; i++) {
            PropertyDescriptor p = this.properties.get(i);
            if (!names.add(p.name())) {
                throw new IllegalArgumentException("Duplicate property name: " + p.name());
            }
            int b = bitsFor(p.domainSize());
            bits[i] = b;
            offsets[i] = shift;
            shift += b;
            if (shift > MAX_BITS) {
                throw new IllegalArgumentException("Properties need " + shift + " bits; at most " + MAX_BITS + " fit");
            }
        }
        this.totalBits = shift;
    }

    /** {@code ceil(log2(domainSize))}, 0 for domains of one value or fewer. */
    public static int bitsFor(int domainSize) {
        if (domainSize <= 1) return 0;
        return 32 - Integer.numberOfLeadingZeros(domainSize - 1);
    }

    public List<PropertyDescriptor> properties() {
        return properties;
    }

    public int totalBits() {
        return totalBits;
    }

    public int bitOffset(int propertyIndex) {
        return offsets[propertyIndex];
    }

    /** Number of distinct states (product of the domain sizes). */
    public long stateCount() {
        long c = 1L;
        for (PropertyDescriptor p : properties) c *= p.domainSize();
        return c;
    }

    /**
     * @param valueIndices one index per property, in declaration order
     * @throws InvalidValueException on a count mismatch or an index outside its property's domain
     */
    public int encode(int... valueIndices) {
        Objects.requireNonNull(valueIndices, "valueIndices");
        if (valueIndices.length != properties.size()) {
            throw new InvalidValueException("Expected " + properties.size() + " values, got " + valueIndices.length);
        }
        int encoded = 0;
        for (int i = 0; i < valueIndices.length; i++) {
            PropertyDescriptor p = properties.get(i);
            int v = valueIndices[i];
            if (v < 0 || v >= p.domainSize()) {
                throw new InvalidValueException("Value index " + v + " out of range for property '" + p.name()
                        + "' (domain size " + p.domainSize() + ")");
            }
            encoded |= v << offsets[i];
        }
        return encoded;
    }

    /** Inverse of {@link #encode(int...)}. Integers that did not come from encode decode to unspecified indices. */
    public int[] decode(int encoded) {
        int[] out = new int[properties.size()];
        for (int i = 0; i < out.length; i++) {
            int b = bits[i];
            if (b == 0) continue;
            int mask = (1 << b) - 1;
            out[i] = (encoded >>> offsets[i]) & mask;
        }
        return out;
    }

    /** Encodes concrete values by property name; properties left out take index 0. */
    public int encodeNamed(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        int[] idx = new int[properties.size()];
        for (Map.Entry<String, ?> e : values.entrySet()) {
            int pi = indexOfProperty(e.getKey());
            if (pi < 0) throw new InvalidValueException("Unknown property: " + e.getKey());
            PropertyDescriptor p = properties.get(pi);
            int vi = p.indexOf(e.getValue());
            if (vi < 0) {
                throw new InvalidValueException("Value " + e.getValue() + " not in domain of property '" + p.name() + "'");
            }
            idx[pi] = vi;
        }
        return encode(idx);
    }

    /** Decodes to concrete values keyed by property name, in declaration order. */
    public Map<String, Object> decodeNamed(int encoded) {
        int[] idx = decode(encoded);
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < idx.length; i++) {
            PropertyDescriptor p = properties.get(i);
            // masked bits can exceed the domain for foreign integers; clamp to keep valueAt happy
            int v = Math.min(idx[i], p.domainSize() - 1);
            out.put(p.name(), p.valueAt(v));
        }
        return out;
    }

    /** State with every property at value index 0. */
    public int defaultState() {
        return 0;
    }

    public int indexOfProperty(String name) {
        for (int i = 0; i < properties.size(); i++) {
            if (properties.get(i).name().equals(name)) return i;
        }
        return -1;
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }
}
