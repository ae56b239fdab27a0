package org.example.progress.event;

import java.time.ZonedDateTime;

public record BookCompletedEvent(
        String readerId,
        String bookId,
        String contextId,
        ZonedDateTime occurredAt
) {
}
