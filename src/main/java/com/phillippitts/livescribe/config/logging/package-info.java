/**
 * Logging context: request MDC for HTTP, connection and session MDC for WebSocket traffic.
 */
package com.phillippitts.livescribe.config.logging;
