package com.clapgrow.tracking.api.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller (or a single handler) as part of the operator surface.
 *
 * Every handler carrying this marker, directly or through its class, must also carry
 * {@link RequireAdminAuth}; the architecture test fails the build otherwise.
 *
 * <pre>
 * {@code
 * @RestController
 * @RequestMapping("/api/v1/tracking/admin")
 * @AdminApi
 * public class AdminTrackingController {
 *     @PostMapping("/classifier/reload")
 *     @RequireAdminAuth
 *     public ResponseEntity<...> reload() { ... }
 * }
 * }
 * </pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface AdminApi {
}
