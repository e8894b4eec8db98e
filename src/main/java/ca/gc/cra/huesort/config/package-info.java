/**
 * Configuration loading (defaults, YAML, CLI) and adapter wiring.
 */
package ca.gc.cra.huesort.config;
