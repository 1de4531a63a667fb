package com.makerhedge.domain.enums;

/**
 * One of the two hedge legs. The first configured trading account is A, the second is B.
 */
public enum LegLabel {
    A,
    B;

    public LegLabel other() {
        return this == A ? B : A;
    }
}
