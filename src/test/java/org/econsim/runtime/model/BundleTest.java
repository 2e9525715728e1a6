package org.econsim.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class BundleTest {

    @Test
    void rejectsNegativeQuantities() {
        assertThatThrownBy(() -> new Bundle(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bundle(1, 0).minus(Good.GOOD1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void swapMovesOneUnitBetweenGoods() {
        Bundle b = new Bundle(3, 1);
        assertThat(b.swap(Good.GOOD1, Good.GOOD2)).isEqualTo(new Bundle(2, 2));
        assertThat(b.total()).isEqualTo(4);
        assertThatThrownBy(() -> Bundle.of(Good.GOOD2, 2).swap(Good.GOOD1, Good.GOOD2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void arithmeticIsComponentWise() {
        Bundle a = new Bundle(2, 5);
        Bundle b = Bundle.of(Good.GOOD2, 3);
        assertThat(a.plus(b)).isEqualTo(new Bundle(2, 8));
        assertThat(a.minus(b)).isEqualTo(new Bundle(2, 2));
        assertThat(a.get(Good.GOOD2)).isEqualTo(5);
        assertThat(Bundle.EMPTY.isEmpty()).isTrue();
        assertThat(a.toString()).isEqualTo("(2, 5)");
    }
}
