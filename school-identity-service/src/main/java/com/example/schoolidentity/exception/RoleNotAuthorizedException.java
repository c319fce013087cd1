package com.example.schoolidentity.exception;

import com.example.schoolidentity.entity.Role;
import org.springframework.http.HttpStatus;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Authenticated caller whose role is not allowed on the route (HTTP 403).
 * Required and actual roles are disclosed since the caller is already authenticated.
 */
public class RoleNotAuthorizedException extends BaseException {

    public RoleNotAuthorizedException(Collection<Role> requiredRoles, Role actualRole) {
        super("FORBIDDEN", buildMessage(requiredRoles, actualRole), HttpStatus.FORBIDDEN);
    }

    private static String buildMessage(Collection<Role> requiredRoles, Role actualRole) {
        String required = requiredRoles.stream()
                .map(Role::tag)
                .collect(Collectors.joining(" or "));
        return "Access denied. Required role: " + required + ". Your role: " + actualRole.tag();
    }
}
