package com.dfsoptimizer.unit.simulation;

import static org.assertj.core.api.Assertions.assertThat;

import com.dfsoptimizer.domain.enums.ContestType;
import com.dfsoptimizer.simulation.PayoutStructure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PayoutStructureTest {

    @Nested
    @DisplayName("Cash")
    class Cash {

        @Test
        @DisplayName("top 45% of the field is paid 1.8x")
        void paysTopFortyFivePercent() {
            PayoutStructure payout = PayoutStructure.cash(100);

            assertThat(payout.getPaidPositions()).isEqualTo(45);
            assertThat(payout.multipleAt(1)).isEqualTo(1.8);
            assertThat(payout.multipleAt(45)).isEqualTo(1.8);
            assertThat(payout.multipleAt(46)).isZero();
        }

        @Test
        @DisplayName("a tiny field still pays first place")
        void tinyField() {
            assertThat(PayoutStructure.cash(2).getPaidPositions()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("GPP")
    class Gpp {

        @Test
        @DisplayName("payout falls with rank and stops at the top 20%")
        void topHeavy() {
            PayoutStructure payout = PayoutStructure.of(ContestType.GPP, 10_000);

            assertThat(payout.getPaidPositions()).isEqualTo(2_000);
            assertThat(payout.multipleAt(1)).isEqualTo(1000.0);
            assertThat(payout.multipleAt(8)).isEqualTo(40.0);
            assertThat(payout.multipleAt(50)).isEqualTo(15.0);
            assertThat(payout.multipleAt(500)).isEqualTo(4.0);
            assertThat(payout.multipleAt(2_000)).isEqualTo(1.5);
            assertThat(payout.multipleAt(2_001)).isZero();
        }

        @Test
        @DisplayName("fractional expected ranks round to the nearest place")
        void fractionalRank() {
            PayoutStructure payout = PayoutStructure.gpp(10_000);

            assertThat(payout.multipleAt(1.4)).isEqualTo(1000.0);
            assertThat(payout.multipleAt(0.2)).isEqualTo(1000.0);
            assertThat(payout.multipleAt(2_000.6)).isZero();
        }

        @Test
        @DisplayName("small fields cap first place at a fifth of the field size")
        void smallFieldCap() {
            PayoutStructure payout = PayoutStructure.gpp(20);

            assertThat(payout.multipleAt(1)).isEqualTo(4.0);
            assertThat(payout.getPaidPositions()).isEqualTo(4);
        }
    }
}
