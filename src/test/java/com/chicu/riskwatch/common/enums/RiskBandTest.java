package com.chicu.riskwatch.common.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RiskBandTest {

    @Test
    void boundariesAreInclusiveOnTheLowerSide() {
        assertEquals(RiskBand.LOW, RiskBand.of(0.0));
        assertEquals(RiskBand.LOW, RiskBand.of(0.2999));
        assertEquals(RiskBand.MEDIUM, RiskBand.of(0.3));
        assertEquals(RiskBand.MEDIUM, RiskBand.of(0.6999));
        assertEquals(RiskBand.HIGH, RiskBand.of(0.7));
        assertEquals(RiskBand.HIGH, RiskBand.of(1.0));
    }

    @Test
    void coloursFollowTrafficLight() {
        assertEquals("Green", RiskBand.LOW.colour());
        assertEquals("Amber", RiskBand.MEDIUM.colour());
        assertEquals("Red", RiskBand.HIGH.colour());
    }
}
