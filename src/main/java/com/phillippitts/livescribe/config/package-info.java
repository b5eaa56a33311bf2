/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.config.ThreadPoolConfig} - session pump and lifecycle
 *       executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.livescribe.config.ThreadPoolMetricsConfig} - executor gauges and
 *       periodic pool health log</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.recognition} - upstream recognition provider wiring</li>
 *   <li>{@code config.collaborator} - identity verifier and meeting API client wiring</li>
 *   <li>{@code config.coordinator} - session coordinator wiring</li>
 *   <li>{@code config.websocket} - client WebSocket endpoint and container limits</li>
 *   <li>{@code config.logging} - MDC filter and logging context keys</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.config;
