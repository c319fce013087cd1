package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.Role;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a handler (or every handler of a controller) to the listed roles.
 * Checked by {@link RoleAuthorizationInterceptor} after the request guard ran.
 * A method-level annotation wins over the class-level one.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequireRoles {

    Role[] value();
}
