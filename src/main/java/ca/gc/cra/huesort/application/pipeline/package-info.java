/**
 * The concurrent hue pipeline: hand-off piles, the hue-ordered result set, the four stage loops and the
 * controller that owns a run.
 * <p>Discovery pushes one {@link ca.gc.cra.huesort.domain.image.WorkItem} per image into the extract pile and
 * finalizes the image total; each stage drains its pile and feeds the next until the total is known and every
 * image sits in the result set. Piles and the result set lock independently, so stages never contend on each
 * other's structures.</p>
 * <p>Worker threads follow the <code>huesort-*</code> naming convention and set the MDC key {@code stage}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.huesort.application.pipeline;
