package com.clapgrow.tracking.api.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Handler requires a valid {@code X-Admin-Key} header. Enforced by AdminAuthAspect,
 * which answers 401 before the handler runs when the key is missing or wrong.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireAdminAuth {
}
