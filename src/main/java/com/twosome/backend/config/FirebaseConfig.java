package com.twosome.backend.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.messaging.FirebaseMessaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Configuration
@ConditionalOnProperty(name = "twosome.firebase.enabled", havingValue = "true", matchIfMissing = true)
public class FirebaseConfig {
    private static final Logger log = LoggerFactory.getLogger(FirebaseConfig.class);

    @Bean
    public FirebaseApp firebaseApp() throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            log.info("Firebase already initialized");
            return FirebaseApp.getInstance();
        }

        try (InputStream serviceAccount = openCredentials()) {
            FirebaseOptions options = FirebaseOptions.builder()
                    .setCredentials(GoogleCredentials.fromStream(serviceAccount))
                    .build();
            FirebaseApp app = FirebaseApp.initializeApp(options);
            log.info("Firebase initialized");
            return app;
        } catch (IOException e) {
            log.error("Firebase initialization failed: {}", e.getMessage());
            throw e;
        }
    }

    @Bean
    public FirebaseAuth firebaseAuth(FirebaseApp firebaseApp) {
        return FirebaseAuth.getInstance(firebaseApp);
    }

    @Bean
    public FirebaseMessaging firebaseMessaging(FirebaseApp firebaseApp) {
        return FirebaseMessaging.getInstance(firebaseApp);
    }

    private InputStream openCredentials() throws IOException {
        String envCredentials = System.getenv("FIREBASE_CREDENTIALS");
        if (envCredentials != null && !envCredentials.isEmpty()) {
            log.info("Using Firebase credentials from environment variable");
            return new ByteArrayInputStream(envCredentials.getBytes(StandardCharsets.UTF_8));
        }

        log.info("Using Firebase credentials from firebase-service-account.json");
        try {
            return new ClassPathResource("firebase-service-account.json").getInputStream();
        } catch (IOException e) {
            log.error("Cannot find firebase-service-account.json on the classpath");
            throw e;
        }
    }
}
