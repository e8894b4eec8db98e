/**
 * Input validation shared by the CLI and configuration layers.
 */
package ca.gc.cra.huesort.validation;
