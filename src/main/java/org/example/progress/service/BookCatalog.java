package org.example.progress.service;

import java.util.Optional;

/**
 * Read-only view of the book catalog used to resolve the reference page count.
 */
public interface BookCatalog {

    Optional<Integer> getEffectiveTotalPages(String bookId);
}
