package io.github.jbellis.lazyjira.model;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/** A comment with its rich-text body already flattened to plain text. */
public record Comment(String id, User author, String body, Instant created, @Nullable Instant updated) {}
