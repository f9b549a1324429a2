package com.foodgram.backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "The requested user does not exist."),
    DUPLICATE_USERNAME(HttpStatus.BAD_REQUEST, "102", "A user with that username already exists."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "103", "Authentication credentials were not provided."),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "104", "A user with that email already exists."),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "105", "The current password is incorrect."),
    AVATAR_REQUIRED(HttpStatus.BAD_REQUEST, "106", "An avatar image is required."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "The requested recipe does not exist."),
    RECIPE_ACCESS_DENIED(HttpStatus.FORBIDDEN, "202", "Only the author or staff may change this recipe."),
    ALREADY_FAVORITED_RECIPE(HttpStatus.BAD_REQUEST, "203", "The recipe is already in favorites."),
    FAVORITE_NOT_FOUND(HttpStatus.BAD_REQUEST, "204", "The recipe is not in favorites."),
    ALREADY_IN_SHOPPING_CART(HttpStatus.BAD_REQUEST, "205", "The recipe is already in the shopping cart."),
    SHOPPING_CART_ITEM_NOT_FOUND(HttpStatus.BAD_REQUEST, "206", "The recipe is not in the shopping cart."),
    EMPTY_SHOPPING_CART(HttpStatus.BAD_REQUEST, "207", "Your shopping cart is empty."),
    RECIPE_IMAGE_REQUIRED(HttpStatus.BAD_REQUEST, "208", "A recipe must have an image."),

    // --- Tag (300) ---
    TAG_NOT_FOUND(HttpStatus.NOT_FOUND, "301", "The requested tag does not exist."),
    DUPLICATE_TAG(HttpStatus.BAD_REQUEST, "302", "A tag with that name or slug already exists."),
    TAG_IN_USE(HttpStatus.BAD_REQUEST, "303", "The tag is used by at least one recipe."),

    // --- Ingredient (400) ---
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "The requested ingredient does not exist."),
    DUPLICATE_INGREDIENT(HttpStatus.BAD_REQUEST, "402", "An ingredient with that name and unit already exists."),
    INGREDIENT_IN_USE(HttpStatus.BAD_REQUEST, "403", "The ingredient is used by at least one recipe."),

    // --- Subscription (500) ---
    SELF_SUBSCRIPTION(HttpStatus.BAD_REQUEST, "501", "You cannot subscribe to yourself."),
    ALREADY_SUBSCRIBED(HttpStatus.BAD_REQUEST, "502", "You are already subscribed to this user."),
    SUBSCRIPTION_NOT_FOUND(HttpStatus.BAD_REQUEST, "503", "You are not subscribed to this user."),

    // --- Auth (600) ---
    INVALID_CREDENTIALS(HttpStatus.BAD_REQUEST, "601", "Unable to log in with provided credentials."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "602", "Invalid token."),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, "603", "You do not have permission to perform this action."),
    ADMIN_ONLY_METHOD(HttpStatus.METHOD_NOT_ALLOWED, "604", "This method is not allowed for non-administrators."),

    // --- Image (700) ---
    INVALID_IMAGE(HttpStatus.BAD_REQUEST, "701", "The uploaded image is not a valid image."),
    IMAGE_STORAGE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "702", "Failed to store the image."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "Invalid input."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "Method not allowed."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "Internal server error."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.BAD_REQUEST, "904", "The request conflicts with existing data."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "905", "Unsupported content type."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
