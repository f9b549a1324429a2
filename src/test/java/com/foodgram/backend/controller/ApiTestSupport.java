package com.foodgram.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodgram.backend.domain.entity.Ingredient;
import com.foodgram.backend.domain.entity.Tag;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.IngredientRepository;
import com.foodgram.backend.domain.repository.TagRepository;
import com.foodgram.backend.domain.repository.UserRepository;
import com.foodgram.backend.domain.type.Role;
import com.foodgram.backend.jwt.JwtTokenProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Shared fixtures for the MockMvc tests. Each test runs in a rolled-back transaction.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
abstract class ApiTestSupport {

    static final String PNG_DATA_URI = "data:image/png;base64,iVBORw0KGgo=";

    @Autowired
    protected MockMvc mockMvc;
    @Autowired
    protected ObjectMapper objectMapper;
    @Autowired
    protected UserRepository userRepository;
    @Autowired
    protected TagRepository tagRepository;
    @Autowired
    protected IngredientRepository ingredientRepository;
    @Autowired
    protected PasswordEncoder passwordEncoder;
    @Autowired
    protected JwtTokenProvider jwtTokenProvider;

    protected User createUser(String username, Role role) {
        return userRepository.save(User.builder()
                .username(username)
                .email(username + "@example.com")
                .firstName("First")
                .lastName("Last")
                .password(passwordEncoder.encode("password-" + username))
                .role(role)
                .build());
    }

    protected Tag createTag(String name, String slug) {
        return tagRepository.save(Tag.builder().name(name).slug(slug).build());
    }

    protected Ingredient createIngredient(String name, String unit) {
        return ingredientRepository.save(Ingredient.builder().name(name).measurementUnit(unit).build());
    }

    protected String token(User user) {
        return "Token " + jwtTokenProvider.createAccessToken(user);
    }

    protected MockHttpServletRequestBuilder withToken(MockHttpServletRequestBuilder request, User user) {
        return request.header(HttpHeaders.AUTHORIZATION, token(user));
    }

    protected MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder request, Object body) throws Exception {
        return request.contentType(MediaType.APPLICATION_JSON).content(objectMapper.writeValueAsString(body));
    }

    protected Map<String, Object> recipeBody(String name, List<Long> tagIds, List<Map<String, Object>> ingredients) {
        return Map.of(
                "name", name,
                "text", "Mix and cook.",
                "cooking_time", 25,
                "image", PNG_DATA_URI,
                "tags", tagIds,
                "ingredients", ingredients
        );
    }

    protected static Map<String, Object> line(Long ingredientId, int amount) {
        return Map.of("id", ingredientId, "amount", amount);
    }

    protected Long readId(String json) throws Exception {
        return objectMapper.readTree(json).get("id").asLong();
    }
}
