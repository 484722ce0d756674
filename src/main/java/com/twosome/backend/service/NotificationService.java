package com.twosome.backend.service;

import com.google.firebase.messaging.AndroidConfig;
import com.google.firebase.messaging.AndroidNotification;
import com.google.firebase.messaging.ApnsConfig;
import com.google.firebase.messaging.Aps;
import com.google.firebase.messaging.ApsAlert;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import com.google.firebase.messaging.Notification;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Sends FCM pushes. Delivery is best effort: failures are logged and never reach the pairing core.
 */
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final ObjectProvider<FirebaseMessaging> firebaseMessaging;

    /**
     * @return true if Firebase accepted the message
     */
    public boolean sendNotification(String token, String title, String body, Map<String, String> data) {
        if (token == null || token.isEmpty()) {
            log.debug("Notification skipped: no FCM token");
            return false;
        }
        FirebaseMessaging messaging = firebaseMessaging.getIfAvailable();
        if (messaging == null) {
            log.debug("Notification skipped: Firebase messaging is disabled");
            return false;
        }

        AndroidConfig androidConfig = AndroidConfig.builder()
                .setPriority(AndroidConfig.Priority.HIGH)
                .setNotification(AndroidNotification.builder()
                        .setSound("default")
                        .setClickAction("FLUTTER_NOTIFICATION_CLICK")
                        .build())
                .build();

        ApnsConfig apnsConfig = ApnsConfig.builder()
                .setAps(Aps.builder()
                        .setAlert(ApsAlert.builder()
                                .setTitle(title)
                                .setBody(body)
                                .build())
                        .setSound("default")
                        .setCategory("COUPLE_PAIRING")
                        .build())
                .putHeader("apns-priority", "10")
                .build();

        Message.Builder messageBuilder = Message.builder()
                .setToken(token)
                .setNotification(Notification.builder()
                        .setTitle(title)
                        .setBody(body)
                        .build())
                .setAndroidConfig(androidConfig)
                .setApnsConfig(apnsConfig);
        if (data != null) {
            messageBuilder.putAllData(data);
        }

        try {
            String response = messaging.send(messageBuilder.build());
            log.info("Notification \"{}\" sent to {}: {}", title, maskToken(token), response);
            return true;
        } catch (FirebaseMessagingException e) {
            log.error("Failed to send notification \"{}\" to {}: {}", title, maskToken(token), e.getMessage(), e);
            return false;
        }
    }

    private static String maskToken(String token) {
        return token.length() > 10
                ? token.substring(0, 5) + "..." + token.substring(token.length() - 5)
                : "SHORT_TOKEN";
    }
}
