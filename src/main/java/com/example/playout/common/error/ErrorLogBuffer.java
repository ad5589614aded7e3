package com.example.playout.common.error;

import com.example.playout.exception.ScheduleFillException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Most recent fill failures, newest first, for display next to the template editor.
 */
@Component
public class ErrorLogBuffer {
    private static final int MAX_ENTRIES = 200;

    private final Deque<Entry> deque = new ConcurrentLinkedDeque<>();

    public void addError(String context, Throwable t) {
        String code = t instanceof ScheduleFillException sfe ? sfe.getErrorCode() : "UNEXPECTED";
        String detail = t == null ? "" : String.valueOf(t.getMessage());
        deque.addFirst(new Entry(LocalDateTime.now(), code, context == null ? "" : context, detail));
        while (deque.size() > MAX_ENTRIES) deque.removeLast();
    }

    public List<Entry> recent() {
        return new ArrayList<>(deque);
    }

    public void clear() {
        deque.clear();
    }

    public record Entry(LocalDateTime time, String errorCode, String context, String detail) {}
}
