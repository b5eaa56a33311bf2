package com.phillippitts.livescribe.config.collaborator;

import com.phillippitts.livescribe.config.properties.AuthProperties;
import com.phillippitts.livescribe.config.properties.CollaboratorProperties;
import com.phillippitts.livescribe.service.collaborator.IdentityVerifier;
import com.phillippitts.livescribe.service.collaborator.JwtIdentityVerifier;
import com.phillippitts.livescribe.service.collaborator.MeetingApiClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the meeting application collaborators: token verification, meeting ownership lookup
 * and transcript persistence.
 */
@Configuration
public class CollaboratorConfig {

    private static final Logger LOG = LogManager.getLogger(CollaboratorConfig.class);

    static final String MEETING_REST_CLIENT_QUALIFIER = "meetingApiRestClient";

    @Bean
    public IdentityVerifier identityVerifier(AuthProperties authProperties) {
        return new JwtIdentityVerifier(authProperties);
    }

    @Bean(name = MEETING_REST_CLIENT_QUALIFIER)
    public RestClient meetingApiRestClient(RestClient.Builder builder, CollaboratorProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());

        builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
        if (properties.serviceToken() != null && !properties.serviceToken().isBlank()) {
            builder.defaultHeader(properties.serviceTokenHeader(), properties.serviceToken());
        } else {
            LOG.warn("livescribe.collaborator.service-token is not set; meeting API calls are unauthenticated");
        }
        return builder.build();
    }

    /**
     * Single client exposed as both {@code SessionOwnershipLookup} and {@code TranscriptPersistence}.
     */
    @Bean
    public MeetingApiClient meetingApiClient(@Qualifier(MEETING_REST_CLIENT_QUALIFIER) RestClient restClient) {
        return new MeetingApiClient(restClient);
    }
}
