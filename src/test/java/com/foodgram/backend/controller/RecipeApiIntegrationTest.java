package com.foodgram.backend.controller;

import com.foodgram.backend.domain.entity.Ingredient;
import com.foodgram.backend.domain.entity.Tag;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.type.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class RecipeApiIntegrationTest extends ApiTestSupport {

    private User author;
    private User other;
    private Tag breakfast;
    private Tag lunch;
    private Ingredient sugar;
    private Ingredient flour;

    @BeforeEach
    void setUp() {
        author = createUser("author", Role.USER);
        other = createUser("other", Role.USER);
        breakfast = createTag("Breakfast", "breakfast");
        lunch = createTag("Lunch", "lunch");
        sugar = createIngredient("sugar", "g");
        flour = createIngredient("flour", "g");
    }

    private Long createRecipe(User user, String name, List<Long> tags, List<Map<String, Object>> lines) throws Exception {
        String body = mockMvc.perform(withToken(json(post("/api/recipes"), recipeBody(name, tags, lines)), user))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return readId(body);
    }

    @Test
    @DisplayName("creating a recipe returns the full detail in snake_case")
    void createRecipe_returnsDetail() throws Exception {
        mockMvc.perform(withToken(json(post("/api/recipes"),
                        recipeBody("Pancakes", List.of(breakfast.getId()), List.of(line(flour.getId(), 200)))), author))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Pancakes"))
                .andExpect(jsonPath("$.cooking_time").value(25))
                .andExpect(jsonPath("$.author.username").value("author"))
                .andExpect(jsonPath("$.author.is_subscribed").value(false))
                .andExpect(jsonPath("$.tags[0].slug").value("breakfast"))
                .andExpect(jsonPath("$.ingredients[0].id").value(flour.getId()))
                .andExpect(jsonPath("$.ingredients[0].measurement_unit").value("g"))
                .andExpect(jsonPath("$.ingredients[0].amount").value(200))
                .andExpect(jsonPath("$.is_favorited").value(false))
                .andExpect(jsonPath("$.is_in_shopping_cart").value(false))
                .andExpect(jsonPath("$.image").value(startsWith("http://testserver/media/recipes/images/")));
    }

    @Test
    @DisplayName("a recipe without tags fails validation on the tags field")
    void createRecipe_withoutTags_returns400() throws Exception {
        Map<String, Object> body = new HashMap<>(recipeBody("Soup", List.of(), List.of(line(sugar.getId(), 10))));

        mockMvc.perform(withToken(json(post("/api/recipes"), body), author))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.tags").exists());
    }

    @Test
    @DisplayName("a recipe without ingredients fails validation on the ingredients field")
    void createRecipe_withoutIngredients_returns400() throws Exception {
        mockMvc.perform(withToken(json(post("/api/recipes"), recipeBody("Soup", List.of(lunch.getId()), List.of())), author))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.ingredients").exists());
    }

    @Test
    @DisplayName("repeating an ingredient fails validation on the ingredients field")
    void createRecipe_duplicateIngredient_returns400() throws Exception {
        mockMvc.perform(withToken(json(post("/api/recipes"), recipeBody("Soup", List.of(lunch.getId()),
                        List.of(line(sugar.getId(), 10), line(sugar.getId(), 20)))), author))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.ingredients").exists());
    }

    @Test
    @DisplayName("cooking time below one minute fails validation")
    void createRecipe_zeroCookingTime_returns400() throws Exception {
        Map<String, Object> body = new HashMap<>(recipeBody("Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10))));
        body.put("cooking_time", 0);

        mockMvc.perform(withToken(json(post("/api/recipes"), body), author))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.cooking_time").exists());
    }

    @Test
    @DisplayName("anonymous users cannot create recipes")
    void createRecipe_anonymous_returns401() throws Exception {
        mockMvc.perform(json(post("/api/recipes"), recipeBody("Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10)))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("only the author may edit; others get 403")
    void updateRecipe_byAnotherUser_returns403() throws Exception {
        Long id = createRecipe(author, "Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10)));
        Map<String, Object> patch = Map.of("tags", List.of(lunch.getId()), "ingredients", List.of(line(flour.getId(), 5)));

        mockMvc.perform(withToken(json(patch("/api/recipes/" + id), patch), other))
                .andExpect(status().isForbidden());

        mockMvc.perform(withToken(json(patch("/api/recipes/" + id), patch), author))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Soup"))
                .andExpect(jsonPath("$.ingredients", hasSize(1)))
                .andExpect(jsonPath("$.ingredients[0].id").value(flour.getId()));
    }

    @Test
    @DisplayName("permission and existence are checked before the PATCH body is validated")
    void updateRecipe_invalidBody_permissionFirst() throws Exception {
        Long id = createRecipe(author, "Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10)));
        Map<String, Object> partial = Map.of("name", "Hijacked");

        mockMvc.perform(withToken(json(patch("/api/recipes/" + id), partial), other))
                .andExpect(status().isForbidden());
        mockMvc.perform(withToken(json(patch("/api/recipes/999999"), partial), other))
                .andExpect(status().isNotFound());
        mockMvc.perform(withToken(json(patch("/api/recipes/" + id), partial), author))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.tags").exists())
                .andExpect(jsonPath("$.errors.ingredients").exists());
    }

    @Test
    @DisplayName("a whitespace-only name is rejected on update")
    void updateRecipe_blankName_returns400() throws Exception {
        Long id = createRecipe(author, "Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10)));
        Map<String, Object> patch = Map.of("name", "   ", "text", "",
                "tags", List.of(lunch.getId()), "ingredients", List.of(line(sugar.getId(), 10)));

        mockMvc.perform(withToken(json(patch("/api/recipes/" + id), patch), author))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.name").exists())
                .andExpect(jsonPath("$.errors.text").exists());
    }

    @Test
    @DisplayName("staff may delete someone else's recipe")
    void deleteRecipe_byModerator_returns204() throws Exception {
        User moderator = createUser("moderator", Role.MODERATOR);
        Long id = createRecipe(author, "Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10)));
        mockMvc.perform(withToken(post("/api/recipes/" + id + "/favorite"), other)).andExpect(status().isCreated());
        mockMvc.perform(withToken(post("/api/recipes/" + id + "/shopping_cart"), other)).andExpect(status().isCreated());

        mockMvc.perform(withToken(delete("/api/recipes/" + id), moderator))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/recipes/" + id))
                .andExpect(status().isNotFound());
        mockMvc.perform(withToken(get("/api/recipes/download_shopping_cart"), other))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("list filters by tag with OR semantics and paginates")
    void listRecipes_filtersAndPaginates() throws Exception {
        createRecipe(author, "Porridge", List.of(breakfast.getId()), List.of(line(flour.getId(), 50)));
        createRecipe(author, "Stew", List.of(lunch.getId()), List.of(line(flour.getId(), 50)));
        createRecipe(other, "Omelette", List.of(breakfast.getId()), List.of(line(sugar.getId(), 5)));

        mockMvc.perform(get("/api/recipes").param("tags", "breakfast").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.results", hasSize(1)))
                .andExpect(jsonPath("$.results[0].name").value("Omelette"))
                .andExpect(jsonPath("$.next").value(containsString("page=2")))
                .andExpect(jsonPath("$.previous").doesNotExist());

        mockMvc.perform(get("/api/recipes").param("tags", "breakfast", "lunch").param("author", String.valueOf(author.getId())))
                .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    @DisplayName("is_favorited=1 narrows the list to the caller's favorites")
    void listRecipes_favoritedFilter() throws Exception {
        Long favorite = createRecipe(author, "Porridge", List.of(breakfast.getId()), List.of(line(flour.getId(), 50)));
        createRecipe(author, "Stew", List.of(lunch.getId()), List.of(line(flour.getId(), 50)));
        mockMvc.perform(withToken(post("/api/recipes/" + favorite + "/favorite"), other)).andExpect(status().isCreated());

        mockMvc.perform(withToken(get("/api/recipes").param("is_favorited", "1"), other))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results[0].id").value(favorite))
                .andExpect(jsonPath("$.results[0].is_favorited").value(true));
    }

    @Test
    @DisplayName("favoriting twice fails the second time; removing an absent favorite fails")
    void favorite_twice_returns400() throws Exception {
        Long id = createRecipe(author, "Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10)));

        mockMvc.perform(withToken(post("/api/recipes/" + id + "/favorite"), other))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Soup"))
                .andExpect(jsonPath("$.cooking_time").value(25));
        mockMvc.perform(withToken(post("/api/recipes/" + id + "/favorite"), other))
                .andExpect(status().isBadRequest());
        mockMvc.perform(withToken(delete("/api/recipes/" + id + "/favorite"), other))
                .andExpect(status().isNoContent());
        mockMvc.perform(withToken(delete("/api/recipes/" + id + "/favorite"), other))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("the shopping list sums the same ingredient across cart recipes")
    void downloadShoppingCart_aggregates() throws Exception {
        Long first = createRecipe(author, "Cake", List.of(breakfast.getId()),
                List.of(line(sugar.getId(), 100), line(flour.getId(), 300)));
        Long second = createRecipe(author, "Cookies", List.of(breakfast.getId()), List.of(line(sugar.getId(), 100)));

        mockMvc.perform(withToken(post("/api/recipes/" + first + "/shopping_cart"), other)).andExpect(status().isCreated());
        mockMvc.perform(withToken(post("/api/recipes/" + second + "/shopping_cart"), other)).andExpect(status().isCreated());

        mockMvc.perform(withToken(get("/api/recipes/download_shopping_cart"), other))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("shopping_list.txt")))
                .andExpect(content().string("flour - 300 g\nsugar - 200 g"));
    }

    @Test
    @DisplayName("downloading an empty cart is a 400")
    void downloadShoppingCart_empty_returns400() throws Exception {
        mockMvc.perform(withToken(get("/api/recipes/download_shopping_cart"), other))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("short links point at the recipe and redirect to the front end")
    void shortLink_roundTrip() throws Exception {
        Long id = createRecipe(author, "Soup", List.of(lunch.getId()), List.of(line(sugar.getId(), 10)));

        mockMvc.perform(get("/api/recipes/" + id + "/get-link"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['short-link']").value("http://testserver/s/" + id));

        mockMvc.perform(get("/s/" + id))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "http://front.test/recipes/" + id));
    }
}
