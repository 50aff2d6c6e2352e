/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the submenu for a plugin package. Place it on the package declaration in {@code
 * package-info.java}:
 *
 * <pre>{@code
 * @MenuGroup("Strain Analysis")
 * package com.example.plugins.strain;
 * }</pre>
 *
 * <p>Packages without the annotation do not produce a submenu; their plugins are attached to the
 * nearest annotated enclosing package, or to the top-level plugin menu.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PACKAGE)
public @interface MenuGroup {
  /** Submenu label. */
  String value();
}
