package org.pragmatica.pegrep.pattern;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Side table of the wildcards of one pattern, indexed by dense id.
 */
public record WildcardTable(List<WildcardInfo> entries) {
    public WildcardTable {
        entries = List.copyOf(entries);
    }

    public WildcardInfo get(int id) {
        return entries.get(id);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Assigns ids while a pattern is tokenized. Repeated occurrences of one wildcard share an id.
     */
    static final class Builder {
        private final List<WildcardInfo> entries = new ArrayList<>();
        private final Map<String, Integer> idsByKey = new HashMap<>();
        private final Map<String, WildcardInfo> byName = new HashMap<>();

        /**
         * Earlier occurrence of the same name written in a different form.
         */
        Optional<WildcardInfo> conflictFor(WildcardInfo info) {
            if (info.isAnonymous()) {
                return Optional.empty();
            }
            var existing = byName.get(info.name());
            if (existing == null || existing.key().equals(info.key())) {
                return Optional.empty();
            }
            return Optional.of(existing);
        }

        int register(WildcardInfo info) {
            var id = idsByKey.get(info.key());
            if (id != null) {
                return id;
            }
            var newId = entries.size();
            entries.add(info);
            idsByKey.put(info.key(), newId);
            byName.putIfAbsent(info.name(), info);
            return newId;
        }

        WildcardTable build() {
            return new WildcardTable(entries);
        }
    }
}
