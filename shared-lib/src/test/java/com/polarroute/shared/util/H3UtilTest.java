package com.polarroute.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class H3UtilTest {

    @Test
    @DisplayName("One arc-minute of latitude is roughly one nautical mile")
    void arcMinuteIsOneNauticalMile() {
        double nm = H3Util.distanceNauticalMiles(60.0, -10.0, 60.0 + 1.0 / 60.0, -10.0);
        assertThat(nm).isCloseTo(1.0, within(0.01));
    }

    @Test
    @DisplayName("Distance to the same point is zero")
    void samePointIsZero() {
        assertThat(H3Util.distanceNauticalMiles(-60.5, -45.0, -60.5, -45.0)).isZero();
    }

    @Test
    @DisplayName("Distance is symmetric")
    void distanceIsSymmetric() {
        double ab = H3Util.distanceKm(-51.7, -57.8, -62.2, -58.9);
        double ba = H3Util.distanceKm(-62.2, -58.9, -51.7, -57.8);
        assertThat(ab).isCloseTo(ba, within(1e-9));
    }

    @Test
    @DisplayName("Cell resolution is honoured")
    void explicitResolution() {
        String coarse = H3Util.latLngToCell(-51.7, -57.8, 3);
        String fine = H3Util.latLngToCell(-51.7, -57.8, 9);
        assertThat(coarse).isNotEqualTo(fine);
    }
}
