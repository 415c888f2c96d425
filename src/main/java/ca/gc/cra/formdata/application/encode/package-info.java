/**
 * <strong>Purpose:</strong> Use case that folds structured values into part trees.
 * <p><strong>Pipeline role:</strong> value -> {@code ValueIntrospector} -> {@code PartTree} -> parts.
 * <p><strong>Concurrency:</strong> Builders are immutable and shareable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.application.encode;
