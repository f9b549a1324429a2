package com.foodgram.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Short links are {@code <short-link base>/s/<recipe id>} and resolve to the front-end recipe page.
 */
@Slf4j
@Service
public class ShortLinkService {

    private final RecipeService recipeService;
    private final String shortLinkBaseUrl;
    private final String frontEndBaseUrl;

    public ShortLinkService(
            RecipeService recipeService,
            @Value("${app.short-link.base-url:http://localhost:8080}") String shortLinkBaseUrl,
            @Value("${app.front-end.base-url:http://localhost:3000}") String frontEndBaseUrl) {
        this.recipeService = recipeService;
        this.shortLinkBaseUrl = stripTrailingSlash(shortLinkBaseUrl);
        this.frontEndBaseUrl = stripTrailingSlash(frontEndBaseUrl);
    }

    public String getShortLink(Long recipeId) {
        return shortLinkBaseUrl + "/s/" + recipeService.requireRecipeId(recipeId);
    }

    public String resolveRecipePage(Long recipeId) {
        String target = frontEndBaseUrl + "/recipes/" + recipeService.requireRecipeId(recipeId);
        log.debug("Short link {} resolved to {}", recipeId, target);
        return target;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
