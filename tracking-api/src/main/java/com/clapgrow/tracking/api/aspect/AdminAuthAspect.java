package com.clapgrow.tracking.api.aspect;

import com.clapgrow.tracking.api.dto.ApiResponse;
import com.clapgrow.tracking.api.service.AdminAuthService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;

/**
 * Enforces the admin key on handlers annotated with {@code @RequireAdminAuth}.
 *
 * The header is read from the current request rather than from handler parameters,
 * so handlers do not need to declare it.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAuthAspect {

    public static final String ADMIN_KEY_HEADER = "X-Admin-Key";

    private final AdminAuthService adminAuthService;

    @Around("@annotation(com.clapgrow.tracking.api.annotation.RequireAdminAuth)")
    public Object enforceAdminAuth(ProceedingJoinPoint joinPoint) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();

        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            log.warn("No request attributes found for method: {}.{}",
                method.getDeclaringClass().getSimpleName(), method.getName());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Internal server error: request context not available"));
        }

        HttpServletRequest request = attributes.getRequest();
        String adminKey = request.getHeader(ADMIN_KEY_HEADER);

        try {
            adminAuthService.validateAdminKey(adminKey);
        } catch (SecurityException e) {
            log.debug("Admin authentication failed for {}.{}: {}",
                method.getDeclaringClass().getSimpleName(), method.getName(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiResponse.error("Authentication required"));
        }

        return joinPoint.proceed();
    }
}
