/**
 * <strong>Purpose:</strong> Reflection- and Jackson-backed discovery of value shapes.
 * <p><strong>Pipeline role:</strong> Infrastructure adapter implementing
 * {@link ca.gc.cra.formdata.application.port.ValueIntrospector}.</p>
 * <p><strong>Concurrency:</strong> Thread-safe; class metadata is cached.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.infrastructure.introspect;
