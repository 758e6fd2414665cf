// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;

import static org.assertj.core.api.Assertions.assertThat;

public class AnimalNamesTests {

  @Property(tries = 200)
  void namesAreThreeKnownWordsAndStable(@ForAll @AlphaChars @NumericChars @StringLength(min = 1, max = 60) String peerId) {
    final var name = AnimalNames.instance.displayName(peerId);

    final var words = name.split(" ");
    assertThat(words).hasSize(3);
    assertThat(AnimalNames.ADJECTIVES).contains(words[0]);
    assertThat(AnimalNames.COLORS).contains(words[1]);
    assertThat(AnimalNames.ANIMALS).contains(words[2]);
    assertThat(new AnimalNames().displayName(peerId)).isEqualTo(name);
  }

  @Example
  void blankIdentifiersAreReturnedAsIs() {
    assertThat(AnimalNames.instance.displayName("")).isEqualTo("");
    assertThat(AnimalNames.instance.displayName(null)).isNull();
  }

  @Example
  void differentPeersUsuallyGetDifferentNames() {
    assertThat(AnimalNames.instance.displayName("QmPeerOne"))
        .isNotEqualTo(AnimalNames.instance.displayName("QmPeerTwo"));
  }
}
