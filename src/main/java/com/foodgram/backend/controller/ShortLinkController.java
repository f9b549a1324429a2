package com.foodgram.backend.controller;

import com.foodgram.backend.service.ShortLinkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@RequiredArgsConstructor
@Tag(name = "Short links")
public class ShortLinkController {

    private final ShortLinkService shortLinkService;

    @GetMapping("/s/{id}")
    @Operation(summary = "Follow a recipe short link", description = "Redirects to the recipe page of the front end.")
    public ResponseEntity<Void> redirect(@PathVariable Long id) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(shortLinkService.resolveRecipePage(id)))
                .build();
    }
}
