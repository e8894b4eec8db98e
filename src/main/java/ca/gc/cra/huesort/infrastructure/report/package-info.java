/**
 * Renders final orderings for operators.
 */
package ca.gc.cra.huesort.infrastructure.report;
