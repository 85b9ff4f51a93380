/**
 * Database-neutral table model: column types, column definitions and identifier rules.
 */
package io.github.yok.csvimporter.schema;
