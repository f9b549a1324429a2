package com.foodgram.backend.controller;

import com.foodgram.backend.domain.dto.tag.TagDto;
import com.foodgram.backend.domain.dto.tag.TagRequestDto;
import com.foodgram.backend.security.CustomUserDetails;
import com.foodgram.backend.service.TagService;
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
@RequestMapping("/api/tags")
@Tag(name = "Tags", description = "Recipe tags; writes are admin only")
public class TagController {

    private final TagService tagService;

    @GetMapping
    @Operation(summary = "List tags")
    public ResponseEntity<List<TagDto>> getTags() {
        return ResponseEntity.ok(tagService.getAllTags());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Tag detail")
    public ResponseEntity<TagDto> getTag(@Parameter(description = "Tag id") @PathVariable Long id) {
        return ResponseEntity.ok(tagService.getTag(id));
    }

    @PostMapping
    @Operation(summary = "Create a tag")
    @SecurityRequirement(name = "token")
    public ResponseEntity<TagDto> createTag(
            @Valid @RequestBody TagRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        AdminGuard.requireAdmin(userDetails);
        return ResponseEntity.status(HttpStatus.CREATED).body(tagService.createTag(dto));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update a tag")
    @SecurityRequirement(name = "token")
    public ResponseEntity<TagDto> updateTag(
            @Parameter(description = "Tag id") @PathVariable Long id,
            @Valid @RequestBody TagRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        AdminGuard.requireAdmin(userDetails);
        return ResponseEntity.ok(tagService.updateTag(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a tag")
    @SecurityRequirement(name = "token")
    public ResponseEntity<Void> deleteTag(
            @Parameter(description = "Tag id") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        AdminGuard.requireAdmin(userDetails);
        tagService.deleteTag(id);
        return ResponseEntity.noContent().build();
    }
}
