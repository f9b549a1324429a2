package com.foodgram.backend.controller;

import com.foodgram.backend.domain.dto.common.PageResponse;
import com.foodgram.backend.domain.dto.user.SubscriptionDto;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.security.CustomUserDetails;
import com.foodgram.backend.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users")
@SecurityRequirement(name = "token")
@Tag(name = "Subscriptions", description = "Following authors")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @GetMapping("/subscriptions")
    @Operation(summary = "Authors I follow", description = "Ordered by username, each with up to `recipes_limit` newest recipes.")
    public ResponseEntity<PageResponse<SubscriptionDto>> getSubscriptions(
            @Parameter(description = "Recipes per author") @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Page<SubscriptionDto> page = subscriptionService.getSubscriptions(requireUserId(userDetails), pageable, recipesLimit);
        return ResponseEntity.ok(PageResponse.of(page, page.getContent(), ServletUriComponentsBuilder.fromCurrentRequest()));
    }

    @PostMapping("/{id}/subscribe")
    @Operation(summary = "Follow an author")
    public ResponseEntity<SubscriptionDto> subscribe(
            @Parameter(description = "Author id") @PathVariable Long id,
            @Parameter(description = "Recipes to include") @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        SubscriptionDto body = subscriptionService.subscribe(requireUserId(userDetails), id, recipesLimit);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @DeleteMapping("/{id}/subscribe")
    @Operation(summary = "Unfollow an author")
    public ResponseEntity<Void> unsubscribe(
            @Parameter(description = "Author id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        subscriptionService.unsubscribe(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    private Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
