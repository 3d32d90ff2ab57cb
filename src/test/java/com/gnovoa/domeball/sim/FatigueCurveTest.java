package com.gnovoa.domeball.sim;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FatigueCurveTest {

  private final FatigueCurve curve = FatigueCurve.from(BalanceConfig.Stamina.defaults());

  @Test
  void noPenaltyAtOrAboveThreshold() {
    assertThat(curve.penaltyFor(20)).isZero();
    assertThat(curve.penaltyFor(35)).isZero();
  }

  @Test
  void linearBelowThreshold() {
    assertThat(curve.penaltyFor(10)).isEqualTo(0.25);
    assertThat(curve.penaltyFor(15)).isEqualTo(0.125);
  }

  @Test
  void exactlyMaximalAtZero() {
    assertThat(curve.penaltyFor(0)).isEqualTo(0.5);
    assertThat(curve.penaltyFor(-3)).isEqualTo(0.5);
  }
}
