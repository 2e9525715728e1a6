package org.econsim.runtime.model;

/**
 * An immutable quantity pair of {@link Good#GOOD1} and {@link Good#GOOD2}.
 * Quantities are never negative; any operation that would produce a negative
 * quantity is rejected as a precondition violation.
 *
 * @param q1 Quantity of Good 1.
 * @param q2 Quantity of Good 2.
 */
public record Bundle(int q1, int q2) {

    /** The zero bundle. */
    public static final Bundle EMPTY = new Bundle(0, 0);

    public Bundle {
        if (q1 < 0 || q2 < 0) {
            throw new IllegalArgumentException("Bundle quantities must be non-negative, got (" + q1 + ", " + q2 + ")");
        }
    }

    /**
     * Creates a bundle holding a single good.
     * @param good The good.
     * @param quantity The quantity of that good.
     * @return A bundle with {@code quantity} of {@code good} and none of the other.
     */
    public static Bundle of(Good good, int quantity) {
        return good == Good.GOOD1 ? new Bundle(quantity, 0) : new Bundle(0, quantity);
    }

    public int get(Good good) {
        return good == Good.GOOD1 ? q1 : q2;
    }

    public Bundle plus(Good good, int amount) {
        return good == Good.GOOD1 ? new Bundle(q1 + amount, q2) : new Bundle(q1, q2 + amount);
    }

    public Bundle minus(Good good, int amount) {
        return plus(good, -amount);
    }

    public Bundle plus(Bundle other) {
        return new Bundle(q1 + other.q1, q2 + other.q2);
    }

    public Bundle minus(Bundle other) {
        return new Bundle(q1 - other.q1, q2 - other.q2);
    }

    /**
     * Applies a 1-for-1 swap.
     *
     * @param gives The good handed over; at least one unit must be present.
     * @param receives The good taken in.
     * @return The bundle after the swap.
     * @throws IllegalArgumentException if no unit of {@code gives} is present.
     */
    public Bundle swap(Good gives, Good receives) {
        return minus(gives, 1).plus(receives, 1);
    }

    public int total() {
        return q1 + q2;
    }

    public boolean isEmpty() {
        return q1 == 0 && q2 == 0;
    }

    @Override
    public String toString() {
        return "(" + q1 + ", " + q2 + ")";
    }
}
