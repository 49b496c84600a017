package io.b2mash.realtime.connect;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConnectedUsersWindowTest {

  @Test
  void freshWindow_isSeededAndNotIdle() {
    var window = ConnectedUsersWindow.seeded();

    assertThat(window.samples()).containsExactly(1);
    assertThat(window.isIdle()).isFalse();
  }

  @Test
  void fiveZeroSamples_areNotEnoughBecauseOfTheSeed() {
    var window = ConnectedUsersWindow.seeded();
    for (int i = 0; i < 5; i++) {
      window.record(0);
    }

    assertThat(window.samples()).containsExactly(1, 0, 0, 0, 0, 0);
    assertThat(window.isIdle()).isFalse();
  }

  @Test
  void sixZeroSamples_makeTheWindowIdle() {
    var window = ConnectedUsersWindow.seeded();
    for (int i = 0; i < 6; i++) {
      window.record(0);
    }

    assertThat(window.samples()).containsExactly(0, 0, 0, 0, 0, 0);
    assertThat(window.isIdle()).isTrue();
  }

  @Test
  void nonZeroSample_onlyShiftsTheWindow() {
    var window = ConnectedUsersWindow.seeded();
    for (int i = 0; i < 6; i++) {
      window.record(0);
    }
    window.record(3);

    assertThat(window.samples()).containsExactly(0, 0, 0, 0, 0, 3);
    assertThat(window.isIdle()).isFalse();

    for (int i = 0; i < 5; i++) {
      window.record(0);
    }
    assertThat(window.isIdle()).isFalse();
    window.record(0);
    assertThat(window.isIdle()).isTrue();
  }
}
