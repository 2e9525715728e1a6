package org.econsim.runtime.model;

/**
 * The two goods traded in the economy.
 */
public enum Good {
    GOOD1,
    GOOD2;

    /**
     * Returns the good that is not this one.
     * @return The complementary good of the two-good economy.
     */
    public Good other() {
        return this == GOOD1 ? GOOD2 : GOOD1;
    }
}
