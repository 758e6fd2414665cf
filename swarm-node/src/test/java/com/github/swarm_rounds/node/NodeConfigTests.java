// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.github.swarm_rounds.BarrierConfig;
import com.github.swarm_rounds.ConfigurationException;
import com.github.swarm_rounds.PeerId;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NodeConfigTests {

  static Properties properties(String... keysAndValues) {
    final var properties = new Properties();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      properties.setProperty(keysAndValues[i], keysAndValues[i + 1]);
    }
    return properties;
  }

  @Test
  void appliesDefaults() {
    final var config = NodeConfig.from(properties("swarm.peer-id", "QmPeer", "swarm.org-id", "org"), Map.of());

    assertThat(config.peerId()).isEqualTo(new PeerId("QmPeer"));
    assertThat(config.orgId()).isEqualTo("org");
    assertThat(config.proxyUrl()).isEqualTo(URI.create("http://localhost:3000"));
    assertThat(config.gossipUrl()).isEmpty();
    assertThat(config.gossipEnabled()).isFalse();
    assertThat(config.dataDir()).isEqualTo(Path.of("swarm-data"));
    assertThat(config.pollInterval()).isEqualTo(Duration.ofSeconds(150));
    assertThat(config.healthPort()).isEmpty();
    assertThat(config.barrier()).isEqualTo(BarrierConfig.defaults());
  }

  @Test
  void environmentOverridesTheFile() {
    final var config = NodeConfig.from(
        properties("swarm.peer-id", "QmFile", "swarm.org-id", "org", "swarm.gossip-poll-seconds", "60"),
        Map.of("SWARM_PEER_ID", "QmEnv",
            "SWARM_GOSSIP_URL", "http://sink:8080/gossip",
            "SWARM_MAX_ROUND", "1000",
            "SWARM_TRAIN_TIMEOUT_DAYS", "2",
            "SWARM_HEALTH_PORT", "8000"));

    assertThat(config.peerId().id()).isEqualTo("QmEnv");
    assertThat(config.gossipUrl()).isEqualTo(Optional.of(URI.create("http://sink:8080/gossip")));
    assertThat(config.pollInterval()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.barrier().maxRound()).isEqualTo(1000);
    assertThat(config.barrier().overallTimeout()).isEqualTo(Duration.ofDays(2));
    assertThat(config.healthPort()).contains(8000);
  }

  @Test
  void missingIdentityIsAConfigurationError() {
    assertThatThrownBy(() -> NodeConfig.from(properties("swarm.org-id", "org"), Map.of()))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("SWARM_PEER_ID");
    assertThatThrownBy(() -> NodeConfig.from(properties("swarm.peer-id", "QmPeer"), Map.of("SWARM_ORG_ID", " ")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("swarm.org-id");
  }

  @Test
  void malformedValuesAreConfigurationErrors() {
    final var base = properties("swarm.peer-id", "QmPeer", "swarm.org-id", "org");
    assertThatThrownBy(() -> NodeConfig.from(base, Map.of("SWARM_GOSSIP_POLL_SECONDS", "often")))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> NodeConfig.from(base, Map.of("SWARM_PROXY_URL", "not a url")))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> NodeConfig.from(base, Map.of("SWARM_GOSSIP_URL", "relative/path")))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void loadsTheBundledDefaults() {
    final var bundled = NodeConfig.class.getClassLoader().getResource(NodeConfig.RESOURCE);
    assertThat(bundled).isNotNull();
  }

  @Test
  void withersReplaceOneSetting() {
    final var config = NodeConfig.from(properties("swarm.peer-id", "QmPeer", "swarm.org-id", "org"), Map.of())
        .withPollInterval(Duration.ofSeconds(5));
    assertThat(config.pollInterval()).isEqualTo(Duration.ofSeconds(5));
    assertThat(NodeConfig.envName("swarm.http-timeout-seconds")).isEqualTo("SWARM_HTTP_TIMEOUT_SECONDS");
  }
}
