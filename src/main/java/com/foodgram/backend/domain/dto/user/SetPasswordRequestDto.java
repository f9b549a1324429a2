package com.foodgram.backend.domain.dto.user;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SetPasswordRequestDto {

    @NotBlank(message = "New password is required.")
    @Size(max = 128, message = "Password must be at most 128 characters.")
    private String newPassword;

    @NotBlank(message = "Current password is required.")
    private String currentPassword;
}
