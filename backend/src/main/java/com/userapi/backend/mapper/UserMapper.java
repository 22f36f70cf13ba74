package com.userapi.backend.mapper;

import com.userapi.backend.dto.UserResponse;
import com.userapi.backend.dto.UserSummary;
import com.userapi.backend.entity.User;
import org.mapstruct.Mapper;

import java.util.List;

// password hash is never mapped: neither DTO has a field for it
@Mapper(componentModel = "spring")
public interface UserMapper {

    UserResponse toResponse(User user);

    List<UserResponse> toResponses(List<User> users);

    UserSummary toSummary(User user);
}
