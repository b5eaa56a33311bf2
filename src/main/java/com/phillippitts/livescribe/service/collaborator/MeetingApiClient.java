package com.phillippitts.livescribe.service.collaborator;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.exception.LiveScribeException;
import com.phillippitts.livescribe.exception.PersistenceException;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * Client for the meeting application's internal API.
 *
 * <ul>
 *   <li>{@code GET /internal/meetings/{id}} returns {@code {"id": "...", "userId": "..."}}</li>
 *   <li>{@code PUT /internal/meetings/{id}/transcript} with
 *       {@code {"transcript": "...", "transcriptionId": "..."}}</li>
 * </ul>
 *
 * <p>The service token header and base URL are set on the {@link RestClient} by
 * {@code CollaboratorConfig}.
 */
public class MeetingApiClient implements SessionOwnershipLookup, TranscriptPersistence {

    private static final Logger LOG = LogManager.getLogger(MeetingApiClient.class);

    private final RestClient restClient;

    public MeetingApiClient(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public Identity ownerOf(String sessionId) {
        String body;
        try {
            body = restClient.get()
                    .uri("/internal/meetings/{id}", sessionId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
        } catch (HttpClientErrorException.NotFound e) {
            throw new SessionNotFoundException(sessionId);
        } catch (RestClientException e) {
            throw new LiveScribeException("Meeting lookup failed for session " + sessionId, e);
        }
        if (body == null || body.isBlank()) {
            throw new LiveScribeException("Empty meeting lookup response for session " + sessionId);
        }
        try {
            String userId = new JSONObject(body).optString("userId", "");
            if (userId.isBlank()) {
                throw new LiveScribeException("Meeting " + sessionId + " has no owner");
            }
            return Identity.of(userId);
        } catch (JSONException e) {
            throw new LiveScribeException("Unparseable meeting lookup response for session " + sessionId, e);
        }
    }

    @Override
    public void persist(String sessionId, String transcript) {
        persist(sessionId, transcript, null);
    }

    @Override
    public void persist(String sessionId, String transcript, String transcriptionId) {
        JSONObject payload = new JSONObject().put("transcript", transcript);
        if (transcriptionId != null) {
            payload.put("transcriptionId", transcriptionId);
        }
        try {
            restClient.put()
                    .uri("/internal/meetings/{id}/transcript", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload.toString())
                    .retrieve()
                    .toBodilessEntity();
            LOG.info("Transcript saved (session={}, chars={})", sessionId, transcript.length());
        } catch (RestClientException e) {
            throw new PersistenceException(sessionId, "Failed to store transcript", e);
        }
    }
}
