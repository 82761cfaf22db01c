package com.chicu.riskwatch.common.enums;

/**
 * Three-tier dropout risk derived from the probability of the risk-positive class.
 * <ul>
 *   <li>{@code p < 0.3} → LOW</li>
 *   <li>{@code 0.3 <= p < 0.7} → MEDIUM</li>
 *   <li>{@code p >= 0.7} → HIGH</li>
 * </ul>
 */
public enum RiskBand {

    LOW("Green"),
    MEDIUM("Amber"),
    HIGH("Red");

    /** Lower bound (inclusive) of MEDIUM. */
    public static final double MEDIUM_FROM = 0.3;

    /** Lower bound (inclusive) of HIGH. */
    public static final double HIGH_FROM = 0.7;

    private final String colour;

    RiskBand(String colour) {
        this.colour = colour;
    }

    public String colour() {
        return colour;
    }

    public static RiskBand of(double probability) {
        return of(probability, MEDIUM_FROM, HIGH_FROM);
    }

    public static RiskBand of(double probability, double mediumFrom, double highFrom) {
        if (probability < mediumFrom) return LOW;
        if (probability < highFrom) return MEDIUM;
        return HIGH;
    }
}
