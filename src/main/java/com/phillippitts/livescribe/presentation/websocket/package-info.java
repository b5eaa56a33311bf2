/**
 * Spring WebSocket transport for the connection gateway.
 */
package com.phillippitts.livescribe.presentation.websocket;
