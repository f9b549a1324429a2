package com.foodgram.backend.controller;

import com.foodgram.backend.domain.dto.common.PageResponse;
import com.foodgram.backend.domain.dto.user.AvatarDto;
import com.foodgram.backend.domain.dto.user.SetPasswordRequestDto;
import com.foodgram.backend.domain.dto.user.UserCreateRequestDto;
import com.foodgram.backend.domain.dto.user.UserCreatedDto;
import com.foodgram.backend.domain.dto.user.UserDto;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.security.CustomUserDetails;
import com.foodgram.backend.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users")
@Tag(name = "Users", description = "Registration, profiles, password and avatar")
public class UserController {

    private final UserService userService;

    @PostMapping
    @Operation(summary = "Register")
    public ResponseEntity<UserCreatedDto> register(@Valid @RequestBody UserCreateRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(dto));
    }

    @GetMapping
    @Operation(summary = "List users")
    public ResponseEntity<PageResponse<UserDto>> getUsers(
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = userDetails != null ? userDetails.getUserId() : null;
        Page<UserDto> page = userService.getUsers(pageable, userId);
        return ResponseEntity.ok(PageResponse.of(page, page.getContent(), ServletUriComponentsBuilder.fromCurrentRequest()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "User profile")
    public ResponseEntity<UserDto> getUser(
            @Parameter(description = "User id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = userDetails != null ? userDetails.getUserId() : null;
        return ResponseEntity.ok(userService.getUser(id, userId));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user")
    @SecurityRequirement(name = "token")
    public ResponseEntity<UserDto> getMe(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(userService.getMe(requireUserId(userDetails)));
    }

    @PostMapping("/set_password")
    @Operation(summary = "Change password")
    @SecurityRequirement(name = "token")
    public ResponseEntity<Void> setPassword(
            @Valid @RequestBody SetPasswordRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        userService.setPassword(requireUserId(userDetails), dto);
        return ResponseEntity.noContent().build();
    }

    @PutMapping(value = "/me/avatar", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Set avatar", description = "The avatar is a base64 data URI.")
    @SecurityRequirement(name = "token")
    public ResponseEntity<AvatarDto> updateAvatar(
            @RequestBody AvatarDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(userService.updateAvatar(requireUserId(userDetails), dto.getAvatar(), null));
    }

    @PutMapping(value = "/me/avatar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload avatar")
    @SecurityRequirement(name = "token")
    public ResponseEntity<AvatarDto> uploadAvatar(
            @RequestPart(value = "avatar", required = false) MultipartFile avatar,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(userService.updateAvatar(requireUserId(userDetails), null, avatar));
    }

    @DeleteMapping("/me/avatar")
    @Operation(summary = "Remove avatar")
    @SecurityRequirement(name = "token")
    public ResponseEntity<Void> deleteAvatar(@AuthenticationPrincipal CustomUserDetails userDetails) {
        userService.deleteAvatar(requireUserId(userDetails));
        return ResponseEntity.noContent().build();
    }

    private Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
