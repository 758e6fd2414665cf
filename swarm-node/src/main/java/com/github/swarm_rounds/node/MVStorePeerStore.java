// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.swarm_rounds.node;

import com.github.swarm_rounds.gossip.PeerStore;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.LinkedHashMap;
import java.util.Map;

/// A local stand-in for the peer-to-peer store. Entries are kept in one map keyed by `key + '\0' + peer` so that a
/// round record is a contiguous key range.
public class MVStorePeerStore implements PeerStore {
  private static final char SEPARATOR = '\0';

  private final MVStore store;
  private final MVMap<String, byte[]> entries;

  public MVStorePeerStore(MVStore store) {
    this.store = store;
    this.entries = store.openMap("com.github.swarm_rounds.node#entries");
  }

  @Override
  public Map<String, byte[]> get(String key) {
    final var prefix = key + SEPARATOR;
    final var record = new LinkedHashMap<String, byte[]>();
    final var cursor = entries.cursor(prefix);
    while (cursor.hasNext()) {
      final var composite = cursor.next();
      if (!composite.startsWith(prefix)) {
        break;
      }
      record.put(composite.substring(prefix.length()), cursor.getValue());
    }
    return record;
  }

  /// Writes one peer's entry under `key`, replacing what that peer wrote before.
  public void put(String key, String peer, byte[] value) {
    entries.put(key + SEPARATOR + peer, value.clone());
    store.commit();
  }
}
