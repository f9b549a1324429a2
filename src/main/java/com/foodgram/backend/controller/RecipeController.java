package com.foodgram.backend.controller;

import com.foodgram.backend.domain.dto.common.PageResponse;
import com.foodgram.backend.domain.dto.recipe.RecipeCreateRequestDto;
import com.foodgram.backend.domain.dto.recipe.RecipeDetailDto;
import com.foodgram.backend.domain.dto.recipe.RecipeSearchCondition;
import com.foodgram.backend.domain.dto.recipe.RecipeUpdateRequestDto;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.security.CustomUserDetails;
import com.foodgram.backend.service.RecipeService;
import com.foodgram.backend.service.ShortLinkService;
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

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "Recipes", description = "Recipe listing, detail, create, update and delete")
public class RecipeController {

    private final RecipeService recipeService;
    private final ShortLinkService shortLinkService;

    @GetMapping
    @Operation(summary = "List recipes", description = "Newest first. Tag slugs combine with OR; the favorite and cart flags apply only to an authenticated caller.")
    public ResponseEntity<PageResponse<RecipeDetailDto>> getRecipes(
            @Parameter(description = "Author id") @RequestParam(required = false) Long author,
            @Parameter(description = "Tag slug, repeatable") @RequestParam(required = false) List<String> tags,
            @Parameter(description = "1 to keep only favorites") @RequestParam(name = "is_favorited", required = false) String isFavorited,
            @Parameter(description = "1 to keep only cart recipes") @RequestParam(name = "is_in_shopping_cart", required = false) String isInShoppingCart,
            @Parameter(description = "Substring of the author's username or a tag slug") @RequestParam(required = false) String search,
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeSearchCondition condition = RecipeSearchCondition.builder()
                .authorId(author)
                .tags(tags)
                .favorited(isTruthy(isFavorited))
                .inShoppingCart(isTruthy(isInShoppingCart))
                .search(search)
                .build();

        Long userId = userDetails != null ? userDetails.getUserId() : null;
        Page<RecipeDetailDto> page = recipeService.getRecipes(condition, pageable, userId);
        return ResponseEntity.ok(PageResponse.of(page, page.getContent(), ServletUriComponentsBuilder.fromCurrentRequest()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Recipe detail")
    public ResponseEntity<RecipeDetailDto> getRecipe(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = userDetails != null ? userDetails.getUserId() : null;
        return ResponseEntity.ok(recipeService.getRecipe(id, userId));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a recipe", description = "The image is sent as a base64 data URI in the body.")
    @SecurityRequirement(name = "token")
    public ResponseEntity<RecipeDetailDto> createRecipe(
            @Valid @RequestBody RecipeCreateRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = requireUserId(userDetails);
        return ResponseEntity.status(HttpStatus.CREATED).body(recipeService.createRecipe(dto, null, userId));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Create a recipe with an uploaded image", description = "`recipe` is the JSON body, `image` the file.")
    @SecurityRequirement(name = "token")
    public ResponseEntity<RecipeDetailDto> createRecipeMultipart(
            @Valid @RequestPart("recipe") RecipeCreateRequestDto dto,
            @RequestPart(value = "image", required = false) MultipartFile image,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = requireUserId(userDetails);
        return ResponseEntity.status(HttpStatus.CREATED).body(recipeService.createRecipe(dto, image, userId));
    }

    @PatchMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update a recipe", description = "Author or staff only. Tags and ingredients replace the current ones.")
    @SecurityRequirement(name = "token")
    public ResponseEntity<RecipeDetailDto> updateRecipe(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @RequestBody RecipeUpdateRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = requireUserId(userDetails);
        return ResponseEntity.ok(recipeService.updateRecipe(id, dto, null, userId));
    }

    @PatchMapping(value = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Update a recipe with an uploaded image")
    @SecurityRequirement(name = "token")
    public ResponseEntity<RecipeDetailDto> updateRecipeMultipart(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @RequestPart("recipe") RecipeUpdateRequestDto dto,
            @RequestPart(value = "image", required = false) MultipartFile image,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = requireUserId(userDetails);
        return ResponseEntity.ok(recipeService.updateRecipe(id, dto, image, userId));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a recipe", description = "Author or staff only.")
    @SecurityRequirement(name = "token")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "Recipe id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = requireUserId(userDetails);
        recipeService.deleteRecipe(id, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/get-link")
    @Operation(summary = "Short link to a recipe")
    public ResponseEntity<Map<String, String>> getShortLink(@Parameter(description = "Recipe id") @PathVariable Long id) {
        return ResponseEntity.ok(Map.of("short-link", shortLinkService.getShortLink(id)));
    }

    private Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }

    private static boolean isTruthy(String flag) {
        return "1".equals(flag) || "true".equalsIgnoreCase(flag);
    }
}
