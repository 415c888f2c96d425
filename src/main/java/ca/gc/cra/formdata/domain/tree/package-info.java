/**
 * Intermediate part tree assembled while walking a value.
 * <p><strong>Role:</strong> Domain structure between the part tree builder and the flat part list; owns the path
 * naming rules ({@code a[b]}, {@code a[0]}).</p>
 * <p><strong>Concurrency:</strong> Immutable; one tree per encode call.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.domain.tree;
