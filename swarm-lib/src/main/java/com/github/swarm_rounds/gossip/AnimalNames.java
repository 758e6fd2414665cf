// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.gossip;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/// Names peers "adjective color animal" from a SHA-256 of the identifier so every peer computes the same name for
/// the same identifier without a lookup.
public class AnimalNames implements PeerDirectory {
  public static final AnimalNames instance = new AnimalNames();

  static final List<String> ADJECTIVES = List.of(
      "agile", "alert", "bold", "brave", "bright", "calm", "clever", "curious", "daring", "eager",
      "fast", "fierce", "gentle", "graceful", "hardy", "humble", "keen", "lively", "loud", "lucky",
      "mighty", "nimble", "noisy", "patient", "playful", "proud", "quick", "quiet", "rapid", "restless",
      "shy", "silent", "sleek", "sly", "smooth", "sneaky", "soft", "sturdy", "swift", "tall",
      "tame", "thick", "tiny", "tough", "vast", "wild", "wise", "witty", "yawning", "zealous");

  static final List<String> COLORS = List.of(
      "amber", "aquatic", "beige", "black", "blue", "bronze", "brown", "coral", "crimson", "cyan",
      "gold", "golden", "gray", "green", "indigo", "ivory", "jade", "lavender", "lime", "magenta",
      "maroon", "mottled", "olive", "orange", "peaceful", "pink", "plump", "purple", "red", "rough",
      "ruby", "rugged", "scaly", "shaggy", "silver", "slender", "snappy", "spotted", "striped", "tan",
      "teal", "thorny", "toothy", "tricky", "turquoise", "violet", "white", "wiry", "woolly", "yellow");

  static final List<String> ANIMALS = List.of(
      "albatross", "ant", "ape", "badger", "bat", "bear", "beaver", "bee", "bison", "buffalo",
      "camel", "cat", "chicken", "cobra", "cod", "crab", "crane", "crow", "deer", "dingo",
      "dog", "dolphin", "dove", "duck", "eagle", "eel", "elephant", "falcon", "ferret", "finch",
      "fox", "frog", "gazelle", "gecko", "goat", "goose", "gorilla", "hamster", "hare", "hawk",
      "hedgehog", "heron", "hippo", "horse", "hyena", "ibis", "jackal", "jaguar", "kangaroo", "koala",
      "lemur", "leopard", "lion", "lizard", "llama", "lobster", "mole", "monkey", "moose", "mouse",
      "mule", "octopus", "okapi", "ostrich", "otter", "owl", "ox", "panda", "parrot", "pelican",
      "penguin", "pig", "porcupine", "rabbit", "raccoon", "ram", "rat", "raven", "rhino", "salmon",
      "seal", "shark", "sheep", "skunk", "sloth", "snail", "spider", "squid", "swan", "tiger",
      "toad", "trout", "turkey", "turtle", "viper", "walrus", "weasel", "whale", "wolf", "zebra");

  @Override
  public String displayName(String peerId) {
    if (peerId == null || peerId.isBlank()) {
      return peerId;
    }
    final byte[] digest = sha256(peerId);
    return pick(ADJECTIVES, digest, 0) + " " + pick(COLORS, digest, 4) + " " + pick(ANIMALS, digest, 8);
  }

  private static String pick(List<String> words, byte[] digest, int offset) {
    final long word = ((digest[offset] & 0xFFL) << 24)
        | ((digest[offset + 1] & 0xFFL) << 16)
        | ((digest[offset + 2] & 0xFFL) << 8)
        | (digest[offset + 3] & 0xFFL);
    return words.get((int) (word % words.size()));
  }

  private static byte[] sha256(String text) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is a required JDK algorithm", e);
    }
  }
}
