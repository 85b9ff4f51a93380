/**
 * Row sources.
 *
 * <p>
 * Reads delimited text files into rows of raw string values keyed by header name.
 * </p>
 */
package io.github.yok.csvimporter.parser;
