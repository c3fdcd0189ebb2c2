/**
 * Spring configuration for the auditor: thread pools, pool metrics and concurrency wiring.
 *
 * <p>Typed settings live in {@code config.properties} and are bound from
 * {@code application.properties}:
 * <ul>
 *   <li>{@code audit.concurrency.*} - concurrency limit and retry defaults</li>
 *   <li>{@code threadpool.audit.*} - audit executor sizing</li>
 * </ul>
 */
package com.alexberriman.domauditor.config;
