/**
 * Process-level helpers: fatal error reporting and JDBC driver loading.
 */
package io.github.yok.csvimporter.util;
