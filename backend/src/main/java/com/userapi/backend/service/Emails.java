package com.userapi.backend.service;

import java.util.Locale;

/**
 * Emails are stored and looked up trimmed and lower-cased, so addresses that
 * differ only in case belong to the same account.
 */
final class Emails {

    private Emails() {
    }

    static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
