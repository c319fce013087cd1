package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.exception.RoleNotAuthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;
import java.util.List;

/**
 * Enforces {@link RequireRoles}. Runs after authentication, so the caller is known;
 * a mismatch is a 403 that names the required roles and the caller's role.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleAuthorizationInterceptor implements HandlerInterceptor {

    private final SecurityContextHelper securityContextHelper;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        RequireRoles requirement = findRequirement(handlerMethod);
        if (requirement == null) {
            return true;
        }

        ResolvedPrincipal principal = securityContextHelper.getCurrentPrincipal()
                .orElseThrow(() -> new AuthenticationFailedException(AuthFailureReason.MISSING_CREDENTIAL));

        List<Role> allowed = Arrays.asList(requirement.value());
        if (!allowed.contains(principal.role())) {
            log.warn("Principal {} with role {} denied on {} {} (requires {})",
                    principal.id(), principal.role(), request.getMethod(), request.getRequestURI(), allowed);
            throw new RoleNotAuthorizedException(allowed, principal.role());
        }
        return true;
    }

    private static RequireRoles findRequirement(HandlerMethod handlerMethod) {
        RequireRoles onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), RequireRoles.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequireRoles.class);
    }
}
