/**
 * Command-line entry points.
 */
package ca.gc.cra.huesort.api;
