package com.example.phoneaddress.service;

import java.util.regex.Pattern;

public final class PhoneNumbers {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D+");

    private PhoneNumbers() {
    }

    /**
     * Reduces a phone number written in any format to its digits, dropping spaces, parentheses,
     * dashes, plus signs and letters. {@code "+7 (999) 123-45-67"} becomes {@code "79991234567"}.
     */
    public static String normalize(String phone) {
        if (phone == null) {
            return "";
        }
        return NON_DIGITS.matcher(phone).replaceAll("");
    }
}
