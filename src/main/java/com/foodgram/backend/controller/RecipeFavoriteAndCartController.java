package com.foodgram.backend.controller;

import com.foodgram.backend.domain.dto.recipe.RecipeShortDto;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.security.CustomUserDetails;
import com.foodgram.backend.service.RecipeFavoriteService;
import com.foodgram.backend.service.ShoppingCartService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@SecurityRequirement(name = "token")
@Tag(name = "Favorites and shopping cart", description = "Favorite and cart membership plus the shopping list download")
public class RecipeFavoriteAndCartController {

    static final String SHOPPING_LIST_FILENAME = "shopping_list.txt";

    private final RecipeFavoriteService favoriteService;
    private final ShoppingCartService shoppingCartService;

    @PostMapping("/{id}/favorite")
    @Operation(summary = "Add to favorites")
    public ResponseEntity<RecipeShortDto> addFavorite(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = requireUserId(userDetails);
        return ResponseEntity.status(HttpStatus.CREATED).body(favoriteService.addFavorite(userId, id));
    }

    @DeleteMapping("/{id}/favorite")
    @Operation(summary = "Remove from favorites")
    public ResponseEntity<Void> removeFavorite(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        favoriteService.removeFavorite(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/shopping_cart")
    @Operation(summary = "Add to shopping cart")
    public ResponseEntity<RecipeShortDto> addToCart(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = requireUserId(userDetails);
        return ResponseEntity.status(HttpStatus.CREATED).body(shoppingCartService.addToCart(userId, id));
    }

    @DeleteMapping("/{id}/shopping_cart")
    @Operation(summary = "Remove from shopping cart")
    public ResponseEntity<Void> removeFromCart(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        shoppingCartService.removeFromCart(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/download_shopping_cart")
    @Operation(summary = "Download the shopping list", description = "Plain text, one line per ingredient with amounts summed across the cart.")
    public ResponseEntity<byte[]> downloadShoppingCart(@AuthenticationPrincipal CustomUserDetails userDetails) {
        String shoppingList = shoppingCartService.buildShoppingList(requireUserId(userDetails));

        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(SHOPPING_LIST_FILENAME).build().toString())
                .body(shoppingList.getBytes(StandardCharsets.UTF_8));
    }

    private Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
