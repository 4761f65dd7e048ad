package com.gbu.assessment.security;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.UUID;

/** Principal built from a verified access token. */
@Getter
@RequiredArgsConstructor
public class AuthenticatedUser {
    private final UUID id;
    private final String email;
    private final String role;
}
