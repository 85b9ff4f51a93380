/**
 * Configuration models bound from {@code application.yml}.
 *
 * <p>
 * Holds connection definitions, import defaults, CSV decoding settings and DBUnit settings.
 * </p>
 */
package io.github.yok.csvimporter.config;
