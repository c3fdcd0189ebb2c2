/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.alexberriman.domauditor.exception.DomAuditorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.alexberriman.domauditor.exception.ConcurrencyException} - Describes a
 *       rejected, failed or exhausted task in the concurrency core</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @since 1.0
 */
package com.alexberriman.domauditor.exception;
