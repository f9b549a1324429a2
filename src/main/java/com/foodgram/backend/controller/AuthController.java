package com.foodgram.backend.controller;

import com.foodgram.backend.domain.dto.auth.AuthTokenDto;
import com.foodgram.backend.domain.dto.auth.TokenLoginRequestDto;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.security.CustomUserDetails;
import com.foodgram.backend.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth/token")
@Tag(name = "Auth", description = "Token login and logout")
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    @Operation(summary = "Obtain a token", description = "Send it back as `Authorization: Token <auth_token>`.")
    public ResponseEntity<AuthTokenDto> login(@Valid @RequestBody TokenLoginRequestDto dto) {
        return ResponseEntity.ok(authService.login(dto));
    }

    @PostMapping("/logout")
    @Operation(summary = "Revoke all tokens of the caller")
    @SecurityRequirement(name = "token")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        authService.logout(userDetails.getUserId());
        return ResponseEntity.noContent().build();
    }
}
