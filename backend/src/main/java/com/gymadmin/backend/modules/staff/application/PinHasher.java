package com.gymadmin.backend.modules.staff.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted one-way hashing of staff PINs. Comparison is delegated to the encoder, which compares in constant time.
 */
@Component
public class PinHasher {

    private final PasswordEncoder passwordEncoder;

    public PinHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String pin) {
        return passwordEncoder.encode(pin);
    }

    public boolean matches(String pin, String pinHash) {
        return passwordEncoder.matches(pin, pinHash);
    }
}
