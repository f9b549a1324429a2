package com.foodgram.backend.controller;

import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.type.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TagAndIngredientApiIntegrationTest extends ApiTestSupport {

    private User admin;
    private User user;

    @BeforeEach
    void setUp() {
        admin = createUser("admin", Role.ADMIN);
        user = createUser("plain", Role.USER);
    }

    @Test
    @DisplayName("anonymous writes get 401, non-admins 405, admins 201 and duplicates 400")
    void tagWrites_anonymousIs401_userIs405_adminIs201() throws Exception {
        Map<String, String> body = Map.of("name", "Dinner", "slug", "dinner");

        mockMvc.perform(json(post("/api/tags"), body))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(withToken(json(post("/api/tags"), body), user))
                .andExpect(status().isMethodNotAllowed());
        mockMvc.perform(withToken(json(post("/api/tags"), body), admin))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slug").value("dinner"));
        mockMvc.perform(withToken(json(post("/api/tags"), body), admin))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("the tag list is public and accepts a trailing slash")
    void tagList_isPublicAndAcceptsTrailingSlash() throws Exception {
        createTag("Breakfast", "breakfast");

        mockMvc.perform(get("/api/tags/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("Breakfast"));
    }

    @Test
    @DisplayName("ingredient search matches a name prefix ignoring case")
    void ingredientSearch_matchesPrefixIgnoringCase() throws Exception {
        createIngredient("Sugar", "g");
        createIngredient("sugar syrup", "ml");
        createIngredient("salt", "g");

        mockMvc.perform(get("/api/ingredients").param("name", "SUG"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].measurement_unit").value("g"));
    }

    @Test
    @DisplayName("a duplicate name and unit pair is rejected and non-admins get 405")
    void ingredientWrites_duplicatePairIs400() throws Exception {
        createIngredient("salt", "g");

        mockMvc.perform(withToken(json(post("/api/ingredients"), Map.of("name", "salt", "measurement_unit", "g")), admin))
                .andExpect(status().isBadRequest());
        mockMvc.perform(withToken(json(post("/api/ingredients"), Map.of("name", "salt", "measurement_unit", "kg")), user))
                .andExpect(status().isMethodNotAllowed());
    }

    @Test
    @DisplayName("a tag or ingredient used by a recipe cannot be deleted")
    void delete_inUse_returns400() throws Exception {
        Long tagId = createTag("Lunch", "lunch").getId();
        Long ingredientId = createIngredient("rice", "g").getId();
        mockMvc.perform(withToken(json(post("/api/recipes"),
                        recipeBody("Rice bowl", List.of(tagId), List.of(line(ingredientId, 100)))), user))
                .andExpect(status().isCreated());

        mockMvc.perform(withToken(delete("/api/tags/" + tagId), admin))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("303"));
        mockMvc.perform(withToken(delete("/api/ingredients/" + ingredientId), admin))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("403"));
        mockMvc.perform(get("/api/tags/" + tagId))
                .andExpect(status().isOk());
    }
}
