package me.bechberger.phidetect.model;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Document-level metadata handed through the confidence pipeline to stages that need it.
 * The engine itself never interprets the attributes.
 */
public class RedactionContext {

    private static final RedactionContext EMPTY = new RedactionContext(null, Map.of());

    private final @Nullable String documentId;
    private final Map<String, Object> attributes;

    public RedactionContext(@Nullable String documentId, Map<String, Object> attributes) {
        this.documentId = documentId;
        this.attributes = attributes != null ? new HashMap<>(attributes) : new HashMap<>();
    }

    public static RedactionContext empty() {
        return EMPTY;
    }

    public static RedactionContext forDocument(String documentId) {
        return new RedactionContext(documentId, Map.of());
    }

    public @Nullable String getDocumentId() { return documentId; }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public @Nullable Object getAttribute(String key) {
        return attributes.get(key);
    }
}
