package com.foodgram.backend.domain.dto.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Public user profile")
public class UserDto {

    private String email;

    private Long id;

    private String username;

    private String firstName;

    private String lastName;

    @JsonProperty("is_subscribed")
    @Schema(description = "Whether the caller follows this user")
    private boolean subscribed;

    @Schema(description = "Avatar URL, null when not set")
    private String avatar;
}
