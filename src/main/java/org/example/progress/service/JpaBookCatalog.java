package org.example.progress.service;

import org.example.progress.entity.BookEntity;
import org.example.progress.repository.BookRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
public class JpaBookCatalog implements BookCatalog {

    private final BookRepository bookRepository;

    public JpaBookCatalog(BookRepository bookRepository) {
        this.bookRepository = bookRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Integer> getEffectiveTotalPages(String bookId) {
        if (bookId == null || bookId.isBlank()) {
            return Optional.empty();
        }
        return bookRepository.findById(bookId)
                .map(BookEntity::getTotalPages)
                .filter(total -> total > 0);
    }
}
