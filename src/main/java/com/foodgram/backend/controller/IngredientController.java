package com.foodgram.backend.controller;

import com.foodgram.backend.domain.dto.ingredient.IngredientDto;
import com.foodgram.backend.domain.dto.ingredient.IngredientRequestDto;
import com.foodgram.backend.security.CustomUserDetails;
import com.foodgram.backend.service.IngredientService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ingredients")
@Tag(name = "Ingredients", description = "Ingredient dictionary; writes are admin only")
public class IngredientController {

    private final IngredientService ingredientService;

    @GetMapping
    @Operation(summary = "List ingredients", description = "Optionally narrowed to names starting with `name`, ignoring case.")
    public ResponseEntity<List<IngredientDto>> getIngredients(
            @Parameter(description = "Name prefix") @RequestParam(required = false) String name
    ) {
        return ResponseEntity.ok(ingredientService.search(name));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Ingredient detail")
    public ResponseEntity<IngredientDto> getIngredient(@Parameter(description = "Ingredient id") @PathVariable Long id) {
        return ResponseEntity.ok(ingredientService.getIngredient(id));
    }

    @PostMapping
    @Operation(summary = "Create an ingredient")
    @SecurityRequirement(name = "token")
    public ResponseEntity<IngredientDto> createIngredient(
            @Valid @RequestBody IngredientRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        AdminGuard.requireAdmin(userDetails);
        return ResponseEntity.status(HttpStatus.CREATED).body(ingredientService.createIngredient(dto));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update an ingredient")
    @SecurityRequirement(name = "token")
    public ResponseEntity<IngredientDto> updateIngredient(
            @Parameter(description = "Ingredient id") @PathVariable Long id,
            @Valid @RequestBody IngredientRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        AdminGuard.requireAdmin(userDetails);
        return ResponseEntity.ok(ingredientService.updateIngredient(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an ingredient")
    @SecurityRequirement(name = "token")
    public ResponseEntity<Void> deleteIngredient(
            @Parameter(description = "Ingredient id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        AdminGuard.requireAdmin(userDetails);
        ingredientService.deleteIngredient(id);
        return ResponseEntity.noContent().build();
    }
}
