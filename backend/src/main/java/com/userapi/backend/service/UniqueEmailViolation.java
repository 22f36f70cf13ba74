package com.userapi.backend.service;

import com.userapi.backend.entity.User;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * Tells a duplicate-email failure apart from other integrity errors (value too
 * long, not null) raised by the same flush.
 */
final class UniqueEmailViolation {

    private UniqueEmailViolation() {
    }

    static boolean isCauseOf(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException
                    && namesEmailConstraint(((ConstraintViolationException) t).getConstraintName())) {
                return true;
            }
            // H2 and some drivers only carry the index name in the message
            if (namesEmailConstraint(t.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private static boolean namesEmailConstraint(String text) {
        return text != null
                && text.toLowerCase(Locale.ROOT).contains(User.EMAIL_UNIQUE_CONSTRAINT);
    }
}
