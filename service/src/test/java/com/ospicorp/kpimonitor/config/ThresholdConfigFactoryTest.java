package com.ospicorp.kpimonitor.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.kpimonitor.threshold.AlertPolicy;
import com.ospicorp.kpimonitor.threshold.Direction;
import com.ospicorp.kpimonitor.threshold.DynamicThresholds;
import com.ospicorp.kpimonitor.threshold.Signal;
import com.ospicorp.kpimonitor.threshold.StaticThresholds;
import com.ospicorp.kpimonitor.threshold.ThresholdConfig;
import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class ThresholdConfigFactoryTest {

  @Test
  void missingModeIsStrictStaticWithoutBounds() {
    ThresholdConfig config = ThresholdConfigFactory.from(new ThresholdProperties());

    assertThat(config).isInstanceOf(StaticThresholds.class);
    var bounds = (StaticThresholds) config;
    assertThat(bounds.lowerThreshold()).isNull();
    assertThat(bounds.upperThreshold()).isNull();
    assertThat(bounds.policy()).isEqualTo(AlertPolicy.STRICT);
    assertThat(bounds.direction()).isEqualTo(Direction.BOTH);
  }

  @Test
  void zeroOrUnparseableDynamicValuesFallBackToDefaults() {
    var props = new ThresholdProperties();
    props.setMode("Dynamic");
    var dynamic = new ThresholdProperties.DynamicBlock();
    dynamic.setK("0");
    dynamic.setWindow("abc");
    dynamic.setZScoreLim("0.0");
    dynamic.setDirection("sideways");
    props.setDynamic(dynamic);

    var config = (DynamicThresholds) ThresholdConfigFactory.from(props);

    assertThat(config.k()).isEqualTo(DynamicThresholds.DEFAULT_K);
    assertThat(config.window()).isEqualTo(30);
    assertThat(config.minHistoryPoints()).isEqualTo(30);
    assertThat(config.zScoreLimit()).isEqualTo(DynamicThresholds.DEFAULT_Z_SCORE_LIMIT);
    assertThat(config.percentDrop()).isEqualTo(DynamicThresholds.DEFAULT_PERCENT_DROP);
    assertThat(config.minSeasonalPoints()).isEqualTo(5);
    assertThat(config.direction()).isEqualTo(Direction.BOTH);
    assertThat(config.signalsEnabled()).containsExactlyInAnyOrder(Signal.values());
    assertThat(config.policy()).isEqualTo(AlertPolicy.DYNAMIC_DEFAULT);
  }

  @Test
  void shortWindowKeepsMinimumHistoryFloor() {
    var props = new ThresholdProperties();
    props.setMode("dynamic");
    var dynamic = new ThresholdProperties.DynamicBlock();
    dynamic.setWindow("5");
    props.setDynamic(dynamic);

    var config = (DynamicThresholds) ThresholdConfigFactory.from(props);

    assertThat(config.minHistoryPoints()).isEqualTo(10);
  }

  @Test
  void explicitZeroPointFloorsAreKept() {
    var props = new ThresholdProperties();
    props.setMode("dynamic");
    var dynamic = new ThresholdProperties.DynamicBlock();
    dynamic.setK("0");
    dynamic.setMinHistoryPoints("0");
    dynamic.setMinSeasonalPoints("0");
    props.setDynamic(dynamic);

    var config = (DynamicThresholds) ThresholdConfigFactory.from(props);

    assertThat(config.minHistoryPoints()).isZero();
    assertThat(config.minSeasonalPoints()).isZero();
    assertThat(config.k()).isEqualTo(DynamicThresholds.DEFAULT_K);
  }

  @Test
  void negativePointFloorsFallBackToDefaults() {
    assertThat(ThresholdConfigFactory.nonNegativeInt("-3", 5)).isEqualTo(5);
    assertThat(ThresholdConfigFactory.nonNegativeInt("0", 5)).isZero();
    assertThat(ThresholdConfigFactory.nonNegativeInt("n/a", 5)).isEqualTo(5);
  }

  @Test
  void partialPolicyBlockFillsDefaults() {
    var props = new ThresholdProperties();
    var policy = new ThresholdProperties.PolicyBlock();
    policy.setYellowIfSignalCountGte(1);
    props.setPolicy(policy);

    assertThat(ThresholdConfigFactory.from(props).policy()).isEqualTo(new AlertPolicy(1, 2));
  }

  @Test
  void unknownSignalCodesAreIgnored() {
    var props = new ThresholdProperties();
    props.setMode("dynamic");
    var dynamic = new ThresholdProperties.DynamicBlock();
    dynamic.setSignalsEnabled(List.of("L", "p", "X"));
    props.setDynamic(dynamic);

    var config = (DynamicThresholds) ThresholdConfigFactory.from(props);

    assertThat(config.signalsEnabled()).containsExactlyInAnyOrder(Signal.L, Signal.P);
  }

  @Test
  void bindsUnderscoreKeysFromConfiguration() {
    var source = new MapConfigurationPropertySource(Map.of(
        "kpi.alerts.AcceptCount.thresholds.mode", "dynamic",
        "kpi.alerts.AcceptCount.thresholds.dynamic.z_score_lim", "3",
        "kpi.alerts.AcceptCount.thresholds.dynamic.window", "14",
        "kpi.alerts.AcceptCount.thresholds.dynamic.exclude_weekdays[0]", "sun",
        "kpi.alerts.AcceptCount.thresholds.policy.red_if_signal_count_gte", "3",
        "kpi.alerts.Originated.thresholds.static.lower_threshold", "50",
        "kpi.alerts.Originated.thresholds.static.direction", "lower_only"));
    KpiProperties properties = new Binder(source).bind("kpi", KpiProperties.class).get();

    var registry = ThresholdConfigFactory.registry(properties.getAlerts());

    var accept = (DynamicThresholds) registry.forMetric("AcceptCount");
    assertThat(accept.zScoreLimit()).isEqualTo(3.0);
    assertThat(accept.window()).isEqualTo(14);
    assertThat(accept.excludedWeekdays()).containsExactly(DayOfWeek.SUNDAY);
    assertThat(accept.policy()).isEqualTo(new AlertPolicy(1, 3));
    var originated = (StaticThresholds) registry.forMetric("originated");
    assertThat(originated.lowerThreshold()).isEqualTo(50.0);
    assertThat(originated.direction()).isEqualTo(Direction.LOWER_ONLY);
    assertThat(originated.policy()).isEqualTo(AlertPolicy.STRICT);
  }
}
