package com.chambua.schoolsports.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/** 32 random bytes from {@link SecureRandom}, hex encoded (64 characters). */
@Component
public class StudentLinkTokenGenerator {

    static final int TOKEN_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    public String nextToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
