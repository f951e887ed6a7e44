package com.launchpad.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller as part of a versioned API surface.
 *
 * Annotated controllers are served under {@code /api/v{value}}; controllers
 * without it are served directly under {@code /api}.
 *
 * @see com.launchpad.config.WebConfig
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ApiVersion {

    /**
     * @return version number without the {@code v} prefix, e.g. {@code "1"}
     */
    String value();
}
