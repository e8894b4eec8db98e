/**
 * Executor construction helpers; worker threads are non-daemon and named after their run and the worker they host.
 */
package ca.gc.cra.huesort.infrastructure.exec;
