/**
 * Column type inference from sampled CSV values.
 */
package io.github.yok.csvimporter.infer;
