package com.phillippitts.livescribe;

import com.phillippitts.livescribe.config.properties.AuthProperties;
import com.phillippitts.livescribe.config.properties.CollaboratorProperties;
import com.phillippitts.livescribe.config.properties.GatewayProperties;
import com.phillippitts.livescribe.config.properties.SessionProperties;
import com.phillippitts.livescribe.config.recognition.DeepgramProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DeepgramProperties.class,
        SessionProperties.class,
        GatewayProperties.class,
        AuthProperties.class,
        CollaboratorProperties.class
})
@EnableScheduling
public class LiveScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveScribeApplication.class, args);
    }

}
