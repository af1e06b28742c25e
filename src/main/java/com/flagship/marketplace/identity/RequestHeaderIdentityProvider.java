package com.flagship.marketplace.identity;

import com.flagship.marketplace.error.MarketplaceException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Reads the identity that the authenticating gateway forwards as headers.
 *
 * {@code X-User-Id} is required. {@code X-User-Role} defaults to MEMBER;
 * SYSTEM cannot be claimed from outside.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestHeaderIdentityProvider implements IdentityProvider {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String USER_ID_MDC_KEY = "userId";

    private final HttpServletRequest request;

    @Override
    public Actor currentUser() {
        String rawId = request.getHeader(USER_ID_HEADER);
        if (rawId == null || rawId.isBlank()) {
            throw MarketplaceException.notAuthorized("Missing authenticated user (" + USER_ID_HEADER + ")");
        }

        UUID userId;
        try {
            userId = UUID.fromString(rawId.trim());
        } catch (IllegalArgumentException e) {
            throw MarketplaceException.notAuthorized("Invalid user id in " + USER_ID_HEADER + ": " + rawId);
        }

        Role role = parseRole(request.getHeader(USER_ROLE_HEADER));
        MDC.put(USER_ID_MDC_KEY, userId.toString());
        return new Actor(userId, role);
    }

    private Role parseRole(String rawRole) {
        if (rawRole == null || rawRole.isBlank()) {
            return Role.MEMBER;
        }
        Role role;
        try {
            role = Role.valueOf(rawRole.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw MarketplaceException.notAuthorized("Unknown role: " + rawRole);
        }
        if (role == Role.SYSTEM) {
            log.warn("Rejected request claiming the SYSTEM role");
            throw MarketplaceException.notAuthorized("The SYSTEM role cannot be claimed by a request");
        }
        return role;
    }
}
