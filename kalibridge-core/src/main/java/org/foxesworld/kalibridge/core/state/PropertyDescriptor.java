package org.foxesworld.kalibridge.core.state;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Finite-domain property declared by a scripted block type.
 *
 * <p>The domain is fixed and ordered; {@link StateCodec} works on value indices into it.
 * Descriptors are immutable.</p>
 */
public abstract class PropertyDescriptor {

    private final String name;

    protected PropertyDescriptor(String name) {
        Objects.requireNonNull(name, "name");
        String n = name.trim();
        if (n.isEmpty()) throw new IllegalArgumentException("Property name is empty");
        this.name = n;
    }

    public final String name() {
        return name;
    }

    /** Number of possible values. */
    public abstract int domainSize();

    /** Concrete value at {@code index} of the domain. */
    public abstract Object valueAt(int index);

    /** Index of {@code value} in the domain, or -1 if it is not part of it. */
    public abstract int indexOf(Object value);

    /** Short type tag: {@code boolean}, {@code int} or {@code direction}. */
    public abstract String type();

    protected final void checkIndex(int index) {
        if (index < 0 || index >= domainSize()) {
            throw new InvalidValueException("Value index " + index + " out of range for property '" + name
                    + "' (domain size " + domainSize() + ")");
        }
    }

    @Override
    public String toString() {
        return type() + "(" + name + ", " + domainSize() + " values)";
    }

    public static BooleanProp bool(String name) {
        return new BooleanProp(name);
    }

    public static IntProp intRange(String name, int min, int max) {
        return new IntProp(name, min, max);
    }

    public static DirectionProp direction(String name, Direction... allowed) {
        return new DirectionProp(name, allowed);
    }

    /**
     * Builds a descriptor from the loosely typed form scripts send:
     * {@code boolean|bool}, {@code int|integer} (min, max) and {@code direction} ("horizontal" or "all").
     */
    public static PropertyDescriptor ofType(String type, String name, Object... args) {
        Objects.requireNonNull(type, "type");
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "boolean", "bool" -> new BooleanProp(name);
            case "int", "integer" -> {
                int min = args.length > 0 ? bound(name, "min", args[0]) : 0;
                int max = args.length > 1 ? bound(name, "max", args[1]) : 15;
                yield new IntProp(name, min, max);
            }
            case "direction" -> {
                if (args.length > 0 && args[0] instanceof String dirType
                        && dirType.trim().equalsIgnoreCase("horizontal")) {
                    yield DirectionProp.horizontal(name);
                }
                yield DirectionProp.all(name);
            }
            default -> throw new IllegalArgumentException("Unknown property type: " + type);
        };
    }

    private static int bound(String name, String which, Object arg) {
        if (!(arg instanceof Number n) || !isIntegral(n)) {
            throw new IllegalArgumentException("Property '" + name + "': " + which + " must be an integer, got " + arg);
        }
        long v = n.longValue();
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Property '" + name + "': " + which + " out of int range: " + arg);
        }
        return (int) v;
    }

    private static boolean isIntegral(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) return true;
        double d = n.doubleValue();
        return !Double.isInfinite(d) && d == Math.rint(d);
    }

    /** {@code false, true}. */
    public static final class BooleanProp extends PropertyDescriptor {

        public BooleanProp(String name) {
            super(name);
        }

        @Override public int domainSize() { return 2; }

        @Override
        public Object valueAt(int index) {
            checkIndex(index);
            return index == 1;
        }

        @Override
        public int indexOf(Object value) {
            if (!(value instanceof Boolean b)) return -1;
            return b ? 1 : 0;
        }

        @Override public String type() { return "boolean"; }
    }

    /** Integers {@code min..max} inclusive. */
    public static final class IntProp extends PropertyDescriptor {

        private final int min;
        private final int max;

        public IntProp(String name, int min, int max) {
            super(name);
            if (max < min) {
                throw new IllegalArgumentException("Property '" + name + "': max " + max + " < min " + min);
            }
            this.min = min;
            this.max = max;
        }

        public int min() { return min; }
        public int max() { return max; }

        @Override
        public int domainSize() {
            long n = (long) max - (long) min + 1L;
            if (n > Integer.MAX_VALUE) throw new IllegalStateException("Property '" + name() + "' domain too large");
            return (int) n;
        }

        @Override
        public Object valueAt(int index) {
            checkIndex(index);
            return min + index;
        }

        @Override
        public int indexOf(Object value) {
            if (!(value instanceof Number n) || !isIntegral(n)) return -1;
            long v = n.longValue();
            if (v < min || v > max) return -1;
            return (int) (v - min);
        }

        @Override public String type() { return "int"; }
    }

    /** Explicit subset of {@link Direction}, in declaration order. */
    public static final class DirectionProp extends PropertyDescriptor {

        private final List<Direction> allowed;

        public DirectionProp(String name, Direction... allowed) {
            super(name);
            Direction[] a = (allowed == null || allowed.length == 0) ? Direction.values() : allowed;
            EnumSet<Direction> seen = EnumSet.noneOf(Direction.class);
            for (Direction d : a) {
                Objects.requireNonNull(d, "direction");
                if (!seen.add(d)) {
                    throw new IllegalArgumentException("Property '" + name + "': duplicate direction " + d);
                }
            }
            if (a.length < 2) {
                throw new IllegalArgumentException("Property '" + name + "' needs at least 2 directions");
            }
            this.allowed = List.copyOf(Arrays.asList(a));
        }

        public static DirectionProp horizontal(String name) {
            return new DirectionProp(name, Direction.HORIZONTAL);
        }

        public static DirectionProp all(String name) {
            return new DirectionProp(name, Direction.values());
        }

        public List<Direction> allowed() {
            return allowed;
        }

        @Override public int domainSize() { return allowed.size(); }

        @Override
        public Object valueAt(int index) {
            checkIndex(index);
            return allowed.get(index);
        }

        @Override
        public int indexOf(Object value) {
            Direction d = (value instanceof Direction dir) ? dir
                    : (value instanceof String s) ? Direction.byName(s) : null;
            return d == null ? -1 : allowed.indexOf(d);
        }

        @Override public String type() { return "direction"; }
    }
}
