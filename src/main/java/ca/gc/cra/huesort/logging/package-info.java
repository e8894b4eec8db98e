/**
 * Runtime logging controls for CLI workflows.
 */
package ca.gc.cra.huesort.logging;
