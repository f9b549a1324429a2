package com.foodgram.backend.controller;

import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.security.CustomUserDetails;

/**
 * Tag and ingredient writes answer 405 rather than 403 to authenticated non-admins.
 */
final class AdminGuard {

    private AdminGuard() {
    }

    static void requireAdmin(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        if (!userDetails.isAdmin()) {
            throw new CustomException(ErrorCode.ADMIN_ONLY_METHOD);
        }
    }
}
