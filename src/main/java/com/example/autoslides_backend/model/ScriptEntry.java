package com.example.autoslides_backend.model;

import java.util.List;
import java.util.Objects;

/**
 * Text content of one slide before layout.
 */
public record ScriptEntry(String title, List<String> bullets, String notes) {

    public ScriptEntry {
        // null bullets from callers are dropped, not rendered
        bullets = bullets == null ? List.of() : bullets.stream().filter(Objects::nonNull).toList();
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasNotes() {
        return notes != null && !notes.isBlank();
    }

    public ScriptEntry withTitle(String newTitle) {
        return new ScriptEntry(newTitle, bullets, notes);
    }
}
