/**
 * Import workflow.
 *
 * <p>
 * {@link io.github.yok.csvimporter.core.CsvImporter} drives one run through sampling,
 * reconciliation against the destination ({@link io.github.yok.csvimporter.core.SchemaReconciler})
 * and batched loading ({@link io.github.yok.csvimporter.core.BatchLoader}). The typed failures of a
 * run all extend {@link io.github.yok.csvimporter.core.CsvImportException}.
 * </p>
 */
package io.github.yok.csvimporter.core;
