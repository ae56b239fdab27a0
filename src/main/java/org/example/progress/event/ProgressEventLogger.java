package org.example.progress.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Audit trail of engine events, written once the originating transaction has
 * committed. Collaborators (gamification, leaderboards) subscribe the same way.
 */
@Component
public class ProgressEventLogger {

    private static final Logger log = LoggerFactory.getLogger(ProgressEventLogger.class);

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProgressAdvanced(ProgressAdvancedEvent event) {
        log.debug("Reader {} advanced book {} by {} pages via {} on {} (now {}%)",
                event.readerId(),
                event.bookId(),
                event.pagesEquivalent(),
                event.medium(),
                event.logDate(),
                event.percent());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookCompleted(BookCompletedEvent event) {
        log.info("Reader {} completed book {}{} at {}",
                event.readerId(),
                event.bookId(),
                event.contextId() == null ? "" : " (context " + event.contextId() + ")",
                event.occurredAt());
    }
}
