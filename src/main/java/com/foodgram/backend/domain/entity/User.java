package com.foodgram.backend.domain.entity;

import com.foodgram.backend.domain.entity.common.BaseTimeEntity;
import com.foodgram.backend.domain.type.Role;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"username"}),
        @UniqueConstraint(columnNames = {"email"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class User extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 150)
    private String username;

    @Column(nullable = false, length = 254)
    private String email;

    @Column(name = "first_name", nullable = false, length = 150)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 150)
    private String lastName;

    @Column(nullable = false)
    private String password;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Role role = Role.USER;

    @Column(name = "avatar_key")
    private String avatarKey;

    @Column(name = "token_version", nullable = false)
    @Builder.Default
    private Integer tokenVersion = 0;

    public boolean isStaff() {
        return role != null && role.isStaff();
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public void changePassword(String encodedPassword) {
        this.password = encodedPassword;
    }

    public void updateAvatarKey(String avatarKey) {
        this.avatarKey = avatarKey;
    }

    public void revokeTokens() {
        this.tokenVersion = (tokenVersion == null ? 0 : tokenVersion) + 1;
    }
}
