package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.auth.AuthTokenDto;
import com.foodgram.backend.domain.dto.auth.TokenLoginRequestDto;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.UserRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.jwt.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    @Transactional(readOnly = true)
    public AuthTokenDto login(TokenLoginRequestDto dto) {
        User user = userRepository.findByEmail(dto.getEmail())
                .filter(u -> passwordEncoder.matches(dto.getPassword(), u.getPassword()))
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_CREDENTIALS));

        log.info("Token issued: userId={}", user.getId());
        return new AuthTokenDto(jwtTokenProvider.createAccessToken(user));
    }

    /**
     * Revokes every token issued to the user so far.
     */
    @Transactional
    public void logout(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        user.revokeTokens();
        log.info("Tokens revoked: userId={}, version={}", userId, user.getTokenVersion());
    }
}
