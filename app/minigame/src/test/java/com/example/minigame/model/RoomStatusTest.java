package com.example.minigame.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RoomStatusTest {

  @Test
  void allowsOnlyLifecycleTransitions() {
    assertThat(RoomStatus.WAITING.canTransitionTo(RoomStatus.PLAYING)).isTrue();
    assertThat(RoomStatus.WAITING.canTransitionTo(RoomStatus.CANCELLED)).isTrue();
    assertThat(RoomStatus.PLAYING.canTransitionTo(RoomStatus.FINISHED)).isTrue();

    assertThat(RoomStatus.PLAYING.canTransitionTo(RoomStatus.CANCELLED)).isFalse();
    assertThat(RoomStatus.WAITING.canTransitionTo(RoomStatus.FINISHED)).isFalse();
    assertThat(RoomStatus.FINISHED.canTransitionTo(RoomStatus.WAITING)).isFalse();
    assertThat(RoomStatus.CANCELLED.canTransitionTo(RoomStatus.PLAYING)).isFalse();
  }

  @Test
  void parsesStoredValueIgnoringCase() {
    assertThat(RoomStatus.fromValue("waiting")).isEqualTo(RoomStatus.WAITING);
    assertThat(RoomStatus.fromValue("FINISHED")).isEqualTo(RoomStatus.FINISHED);
    assertThat(RoomStatus.PLAYING.isActive()).isTrue();
    assertThat(RoomStatus.CANCELLED.isActive()).isFalse();
  }

  @Test
  void rejectsUnknownValue() {
    assertThatThrownBy(() -> RoomStatus.fromValue("paused"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
