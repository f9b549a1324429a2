package com.foodgram.backend.domain.dto.user;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UserCreateRequestDto {

    @NotBlank(message = "Email is required.")
    @Email(message = "Enter a valid email address.")
    @Size(max = 254, message = "Email must be at most 254 characters.")
    private String email;

    @NotBlank(message = "Username is required.")
    @Size(max = 150, message = "Username must be at most 150 characters.")
    @Pattern(regexp = "^[\\w.@+-]+$", message = "Username may contain only letters, digits and @/./+/-/_.")
    private String username;

    @NotBlank(message = "First name is required.")
    @Size(max = 150, message = "First name must be at most 150 characters.")
    private String firstName;

    @NotBlank(message = "Last name is required.")
    @Size(max = 150, message = "Last name must be at most 150 characters.")
    private String lastName;

    @NotBlank(message = "Password is required.")
    @Size(max = 128, message = "Password must be at most 128 characters.")
    private String password;
}
