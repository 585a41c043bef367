package org.foxesworld.kalibridge.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class StateCodecTest {

    @Test
    void packsPropertiesSequentially() {
        StateCodec codec = new StateCodec(List.of(
                PropertyDescriptor.bool("powered"),
                PropertyDescriptor.intRange("power", 0, 15)));

        assertThat(codec.encode(1, 5)).isEqualTo(1 + (5 << 1)).isEqualTo(11);
        assertThat(codec.decode(11)).containsExactly(1, 5);
        assertThat(codec.totalBits()).isEqualTo(5);
    }

    @Test
    void everyStateRoundTripsAndEncodingsAreDistinct() {
        List<List<PropertyDescriptor>> shapes = List.of(
                List.of(PropertyDescriptor.bool("powered"), PropertyDescriptor.intRange("power", 0, 15)),
                List.of(PropertyDescriptor.DirectionProp.horizontal("facing"),
                        PropertyDescriptor.intRange("age", 0, 2),
                        PropertyDescriptor.bool("lit")),
                List.of(PropertyDescriptor.DirectionProp.all("facing"),
                        PropertyDescriptor.intRange("fixed", 4, 4),
                        PropertyDescriptor.intRange("level", -3, 3)));

        for (List<PropertyDescriptor> shape : shapes) {
            StateCodec codec = new StateCodec(shape);
            List<int[]> points = cartesian(shape);
            Set<Integer> encodings = new HashSet<>();

            for (int[] point : points) {
                int encoded = codec.encode(point);
                assertThat(encoded).isNotNegative();
                assertThat(codec.decode(encoded)).containsExactly(point);
                encodings.add(encoded);
            }
            assertThat(encodings).hasSize(points.size());
            assertThat((long) points.size()).isEqualTo(codec.stateCount());
        }
    }

    @Test
    void booleanPlusSixteenValuesGivesThirtyTwoStates() {
        StateCodec codec = new StateCodec(List.of(
                PropertyDescriptor.bool("powered"),
                PropertyDescriptor.intRange("power", 0, 15)));

        Set<Integer> encodings = new HashSet<>();
        for (int[] point : cartesian(codec.properties())) encodings.add(codec.encode(point));

        assertThat(encodings).hasSize(32);
    }

    @Test
    void noPropertiesAlwaysEncodeToZero() {
        assertThat(StateCodec.EMPTY.encode()).isZero();
        assertThat(StateCodec.EMPTY.decode(0)).isEmpty();
        assertThat(StateCodec.EMPTY.stateCount()).isEqualTo(1L);
    }

    @Test
    void singleValueDomainTakesNoBits() {
        StateCodec codec = new StateCodec(List.of(
                PropertyDescriptor.intRange("constant", 7, 7),
                PropertyDescriptor.bool("open")));

        assertThat(StateCodec.bitsFor(1)).isZero();
        assertThat(codec.bitOffset(1)).isZero();
        assertThat(codec.encode(0, 1)).isEqualTo(1);
        assertThat(codec.decode(1)).containsExactly(0, 1);
    }

    @Test
    void bitWidthIsCeilLog2() {
        assertThat(StateCodec.bitsFor(2)).isEqualTo(1);
        assertThat(StateCodec.bitsFor(3)).isEqualTo(2);
        assertThat(StateCodec.bitsFor(4)).isEqualTo(2);
        assertThat(StateCodec.bitsFor(6)).isEqualTo(3);
        assertThat(StateCodec.bitsFor(16)).isEqualTo(4);
        assertThat(StateCodec.bitsFor(17)).isEqualTo(5);
    }

    @Test
    void outOfDomainIndexIsRejected() {
        StateCodec codec = new StateCodec(List.of(
                PropertyDescriptor.bool("powered"),
                PropertyDescriptor.intRange("power", 0, 15)));

        assertThatThrownBy(() -> codec.encode(2, 0)).isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> codec.encode(0, 16)).isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> codec.encode(0, -1)).isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> codec.encode(0)).isInstanceOf(InvalidValueException.class);
    }

    @Test
    void namedValuesUseDomainOrder() {
        StateCodec codec = new StateCodec(List.of(
                PropertyDescriptor.DirectionProp.horizontal("facing"),
                PropertyDescriptor.intRange("power", 1, 4)));

        int encoded = codec.encodeNamed(Map.of("facing", Direction.EAST, "power", 3));

        // EAST is index 2 of N,S,E,W; power 3 is index 2 of 1..4
        assertThat(encoded).isEqualTo(2 | (2 << 2));
        assertThat(codec.decodeNamed(encoded))
                .containsEntry("facing", Direction.EAST)
                .containsEntry("power", 3);
        assertThatThrownBy(() -> codec.encodeNamed(Map.of("facing", Direction.UP)))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> codec.encodeNamed(Map.of("missing", true)))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void fractionalNumbersAreNotIntegerValues() {
        StateCodec codec = new StateCodec(List.of(PropertyDescriptor.intRange("power", 0, 15)));

        assertThatThrownBy(() -> codec.encodeNamed(Map.of("power", 2.7)))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> codec.encodeNamed(Map.of("power", Double.NaN)))
                .isInstanceOf(InvalidValueException.class);
        assertThat(codec.encodeNamed(Map.of("power", 3.0))).isEqualTo(3);
        assertThat(codec.encodeNamed(Map.of("power", 12L))).isEqualTo(12);
    }

    @Test
    void looselyTypedIntBoundsMustBeIntegers() {
        assertThatThrownBy(() -> PropertyDescriptor.ofType("int", "age", "zero", 7))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PropertyDescriptor.ofType("int", "age", 0, 7.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PropertyDescriptor.ofType("int", "age", 0, 1L << 40))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(PropertyDescriptor.ofType("int", "age", 1.0, 4.0).domainSize()).isEqualTo(4);
    }

    @Test
    void duplicateNamesAndOversizedLayoutsAreRejected() {
        assertThatThrownBy(() -> new StateCodec(List.of(
                PropertyDescriptor.bool("lit"), PropertyDescriptor.bool("lit"))))
                .isInstanceOf(IllegalArgumentException.class);

        List<PropertyDescriptor> wide = new ArrayList<>();
        for (int i = 0; i < 4; i++) wide.add(PropertyDescriptor.intRange("p" + i, 0, 255));
        assertThatThrownBy(() -> new StateCodec(wide)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void directionSubsetNeedsTwoToSixDistinctFaces() {
        assertThatThrownBy(() -> PropertyDescriptor.direction("facing", Direction.UP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PropertyDescriptor.direction("facing", Direction.UP, Direction.UP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(PropertyDescriptor.direction("facing", Direction.UP, Direction.DOWN).domainSize()).isEqualTo(2);
        assertThat(PropertyDescriptor.ofType("direction", "facing", "horizontal").domainSize()).isEqualTo(4);
        assertThat(PropertyDescriptor.ofType("integer", "age", 0, 7).domainSize()).isEqualTo(8);
    }

    private static List<int[]> cartesian(List<PropertyDescriptor> shape) {
        List<int[]> out = new ArrayList<>();
        out.add(new int[0]);
        for (PropertyDescriptor p : shape) {
            List<int[]> next = new ArrayList<>();
            for (int[] prefix : out) {
                for (int v = 0; v < p.domainSize(); v++) {
                    int[] point = java.util.Arrays.copyOf(prefix, prefix.length + 1);
                    point[prefix.length] = v;
                    next.add(point);
                }
            }
            out = next;
        }
        return out;
    }
}
