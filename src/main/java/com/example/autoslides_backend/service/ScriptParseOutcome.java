package com.example.autoslides_backend.service;

import com.example.autoslides_backend.model.ScriptEntry;

import java.util.List;

/**
 * Result of reading a model answer as a slide script.
 *
 * @param kind      how well the answer matched the requested slide count.
 * @param entries   parsed entries, never more than requested; empty when {@link Kind#UNUSABLE}.
 * @param requested slide count that was asked for.
 * @param reason    why the answer was unusable, otherwise {@code null}.
 */
public record ScriptParseOutcome(Kind kind, List<ScriptEntry> entries, int requested, String reason) {

    public enum Kind {
        /** Exactly the requested count, possibly after dropping extra slides. */
        COMPLETE,
        /** Fewer entries than requested. */
        SHORTFALL,
        /** No JSON object or no slides array. */
        UNUSABLE
    }

    public ScriptParseOutcome {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    static ScriptParseOutcome unusable(int requested, String reason) {
        return new ScriptParseOutcome(Kind.UNUSABLE, List.of(), requested, reason);
    }

    public int missing() {
        return Math.max(0, requested - entries.size());
    }
}
