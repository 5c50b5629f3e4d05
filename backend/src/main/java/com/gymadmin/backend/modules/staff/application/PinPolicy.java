package com.gymadmin.backend.modules.staff.application;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Format rules for staff PINs. Weak PINs are refused when a PIN is set, never when one is checked.
 */
public final class PinPolicy {

    private static final Pattern PIN_FORMAT = Pattern.compile("^\\d{4}$");

    private static final Set<String> WEAK_PINS = Set.of(
            "0000", "1111", "2222", "3333", "4444", "5555", "6666", "7777", "8888", "9999",
            "1234", "4321", "0123", "3210"
    );

    private PinPolicy() {
    }

    public static boolean isWellFormed(String pin) {
        return pin != null && PIN_FORMAT.matcher(pin).matches();
    }

    public static boolean isWeak(String pin) {
        return WEAK_PINS.contains(pin);
    }
}
