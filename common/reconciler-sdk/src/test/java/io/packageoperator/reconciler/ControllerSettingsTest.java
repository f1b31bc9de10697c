package io.packageoperator.reconciler;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ControllerSettingsTest {

  @Test
  void backoffDoublesUpToTheCap() {
    ControllerSettings settings = new ControllerSettings(1, Duration.ofSeconds(30), null, Duration.ofSeconds(1));

    assertThat(settings.backoff(1)).isEqualTo(Duration.ofMillis(100));
    assertThat(settings.backoff(2)).isEqualTo(Duration.ofMillis(200));
    assertThat(settings.backoff(4)).isEqualTo(Duration.ofMillis(800));
    assertThat(settings.backoff(5)).isEqualTo(Duration.ofSeconds(1));
    assertThat(settings.backoff(64)).isEqualTo(Duration.ofSeconds(1));
  }

  @Test
  void mergeKeepsTheEarliestRequeue() {
    ReconcileResult soon = ReconcileResult.requeueAfter(Duration.ofSeconds(1));
    ReconcileResult later = ReconcileResult.requeueAfter(Duration.ofSeconds(5));

    assertThat(later.merge(soon)).isEqualTo(soon);
    assertThat(ReconcileResult.done().merge(later)).isEqualTo(later);
    assertThat(soon.merge(ReconcileResult.done())).isEqualTo(soon);
  }
}
