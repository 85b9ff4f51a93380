/**
 * Root package of CsvImporter.
 *
 * <p>
 * Provides a CLI that loads a delimited text file into a relational table, creating the table from
 * types inferred from the data when needed.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.csvimporter.config}: configuration models</li>
 * <li>{@code io.github.yok.csvimporter.core}: import workflow</li>
 * <li>{@code io.github.yok.csvimporter.db}: database dialects and JDBC/DBUnit access</li>
 * <li>{@code io.github.yok.csvimporter.infer}: type inference</li>
 * <li>{@code io.github.yok.csvimporter.parser}: row sources</li>
 * </ul>
 */
package io.github.yok.csvimporter;
