/**
 * Service layer: session lifecycle, upstream recognition, broadcasting and collaborators.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.session} - live session registry and per-session state</li>
 *   <li>{@code service.recognition} - streaming recognition client abstraction (Deepgram)</li>
 *   <li>{@code service.transcript} - ordered final-fragment buffer</li>
 *   <li>{@code service.coordinator} - session state machine and teardown</li>
 *   <li>{@code service.gateway} - wire events, rooms and the connection entry point</li>
 *   <li>{@code service.collaborator} - identity, ownership and transcript persistence</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - observability</li>
 * </ul>
 *
 * <p>Services throw domain exceptions from {@code com.phillippitts.livescribe.exception}, never
 * HTTP exceptions, and use constructor injection.
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.service;
