/*
 * CumulCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.cumulcp.cp.engine.constraints.scheduling;

/**
 * Compact record of why a bound was changed: the rule that fired and, for the
 * window based rules, the time window it reasoned on.
 * It is packed into the single int a host stores next to each bound change:
 * bits 0-3 hold the rule, bits 4-16 the window start and bits 17-31 the window end.
 * For {@link PropagationRule#CORE_TIME_HOLES} the two fields hold the indicator position
 * and the blocking timepoint.
 */
public final class InferInfo {

    static final int RULE_BITS = 4;
    static final int EST_BITS = 13;
    static final int LCT_BITS = 15;

    public static final int MAX_EST = (1 << EST_BITS) - 1;
    public static final int MAX_LCT = (1 << LCT_BITS) - 1;

    private static final int RULE_MASK = (1 << RULE_BITS) - 1;

    public static final InferInfo INVALID = new InferInfo(PropagationRule.INVALID, 0, 0);

    private final PropagationRule rule;
    private final int est;
    private final int lct;

    /**
     * @throws IllegalArgumentException if est or lct does not fit in its field,
     *         use {@link #fits(int, int)} first
     */
    public InferInfo(PropagationRule rule, int est, int lct) {
        if (!fits(est, lct)) {
            throw new IllegalArgumentException("window [" + est + "," + lct + "] cannot be encoded");
        }
        this.rule = rule;
        this.est = est;
        this.lct = lct;
    }

    public static boolean fits(int est, int lct) {
        return est >= 0 && est <= MAX_EST && lct >= 0 && lct <= MAX_LCT;
    }

    public PropagationRule rule() {
        return rule;
    }

    public int est() {
        return est;
    }

    public int lct() {
        return lct;
    }

    public int toInt() {
        return rule.id() | (est << RULE_BITS) | (lct << (RULE_BITS + EST_BITS));
    }

    public static InferInfo fromInt(int word) {
        PropagationRule rule = PropagationRule.fromId(word & RULE_MASK);
        int est = (word >>> RULE_BITS) & MAX_EST;
        int lct = word >>> (RULE_BITS + EST_BITS);
        return new InferInfo(rule, est, lct);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof InferInfo)) {
            return false;
        }
        InferInfo other = (InferInfo) o;
        return rule == other.rule && est == other.est && lct == other.lct;
    }

    @Override
    public int hashCode() {
        return toInt();
    }

    @Override
    public String toString() {
        return rule + "[" + est + "," + lct + "]";
    }
}
