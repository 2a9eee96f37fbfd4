package com.example.authservice.dto;

import java.util.List;

public record UserListResponse(
    boolean ok,
    List<UserProfile> users
) {
    public static UserListResponse of(List<UserProfile> users) {
        return new UserListResponse(true, users);
    }
}
