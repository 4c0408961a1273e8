package com.vidly.mapper;

import com.vidly.dto.request.UserRequest;
import com.vidly.dto.response.UserResponse;
import com.vidly.entity.User;

import java.util.Locale;

public final class UserMapper {

    private UserMapper() {}

    public static User toEntity(UserRequest request) {
        User user = new User();
        updateEntity(user, request);
        return user;
    }

    public static UserResponse toResponse(User user) {
        return new UserResponse(user.getId(), user.getName(), user.getEmail(), user.isAdmin());
    }

    public static void updateEntity(User user, UserRequest request) {
        user.setName(request.name().trim());
        user.setEmail(normalizeEmail(request.email()));
        user.setAdmin(Boolean.TRUE.equals(request.isAdmin()));
    }

    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
