/**
 * Connection gateway: wire events, per-session rooms and the transport-independent entry point
 * used by the WebSocket handler.
 */
package com.phillippitts.livescribe.service.gateway;
