package org.example.progress.model;

/**
 * Natural key of a progress record: one read-through of a book by a reader.
 * A blank context id means the read-through is not bound to an event.
 */
public record ProgressKey(
        String readerId,
        String bookId,
        String contextId
) {

    public ProgressKey {
        if (readerId == null || readerId.isBlank()) {
            throw new IllegalArgumentException("readerId is required");
        }
        if (bookId == null || bookId.isBlank()) {
            throw new IllegalArgumentException("bookId is required");
        }
        readerId = readerId.trim();
        bookId = bookId.trim();
        contextId = contextId == null || contextId.isBlank() ? null : contextId.trim();
    }

    public static ProgressKey of(String readerId, String bookId) {
        return new ProgressKey(readerId, bookId, null);
    }

    public String contextKey() {
        return contextId == null ? "" : contextId;
    }
}
