package org.dagnet.query.constraint;

/**
 * Sign of an inclusion-exclusion term.
 */
public enum Coefficient {
    PLUS(1),
    MINUS(-1);

    private final int sign;

    Coefficient(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    /**
     * Returns {@code (-1)^size}: odd subsets subtract, even subsets add back.
     */
    public static Coefficient forSubsetSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("subset size must be > 0");
        }
        return (size & 1) == 1 ? MINUS : PLUS;
    }
}
