package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.exception.RoleNotAuthorizedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.method.HandlerMethod;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleAuthorizationInterceptorTest {

    private final RoleAuthorizationInterceptor interceptor =
            new RoleAuthorizationInterceptor(new SecurityContextHelper());
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/auth/staff");
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @RequireRoles({Role.ADMIN, Role.SCHOOL_ADMIN})
    static class AdminRoutes {

        public void create() {
        }

        @RequireRoles(Role.TEACHER)
        public void teachersOnly() {
        }
    }

    static class OpenRoutes {

        public void anyone() {
        }
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private static HandlerMethod handler(Object bean, String method) throws NoSuchMethodException {
        return new HandlerMethod(bean, bean.getClass().getMethod(method));
    }

    private static void authenticateAs(Role role) {
        ResolvedPrincipal principal = new ResolvedPrincipal("p-1", PrincipalKind.STAFF, role, "school-1",
                "p@school.test", "P", true, false, List.of(), null);
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority(role.authority()))));
    }

    @Test
    void unannotatedRouteIsOpen() throws Exception {
        assertTrue(interceptor.preHandle(request, response, handler(new OpenRoutes(), "anyone")));
    }

    @Test
    void allowedRolePasses() throws Exception {
        authenticateAs(Role.SCHOOL_ADMIN);

        assertTrue(interceptor.preHandle(request, response, handler(new AdminRoutes(), "create")));
    }

    @Test
    void mismatchNamesRequiredAndActualRole() throws Exception {
        authenticateAs(Role.TEACHER);
        HandlerMethod handler = handler(new AdminRoutes(), "create");

        RoleNotAuthorizedException ex = assertThrows(RoleNotAuthorizedException.class,
                () -> interceptor.preHandle(request, response, handler));

        assertEquals(HttpStatus.FORBIDDEN, ex.getStatus());
        assertEquals("Access denied. Required role: admin or school_admin. Your role: teacher", ex.getMessage());
    }

    @Test
    void methodAnnotationOverridesClassAnnotation() throws Exception {
        authenticateAs(Role.TEACHER);
        assertTrue(interceptor.preHandle(request, response, handler(new AdminRoutes(), "teachersOnly")));

        authenticateAs(Role.ADMIN);
        HandlerMethod handler = handler(new AdminRoutes(), "teachersOnly");
        assertThrows(RoleNotAuthorizedException.class, () -> interceptor.preHandle(request, response, handler));
    }

    @Test
    void anonymousCallerOnProtectedRouteIsUnauthenticated() throws Exception {
        HandlerMethod handler = handler(new AdminRoutes(), "create");

        AuthenticationFailedException ex = assertThrows(AuthenticationFailedException.class,
                () -> interceptor.preHandle(request, response, handler));
        assertEquals(AuthFailureReason.MISSING_CREDENTIAL, ex.getReason());
    }
}
