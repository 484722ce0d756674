package com.twosome.backend.controller;

import com.twosome.backend.model.Couple;
import com.twosome.backend.model.CoupleInvitation;
import com.twosome.backend.model.CoupleStats;
import com.twosome.backend.model.User;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Map-shaped response bodies for the pairing endpoints.
 */
final class PairingResponses {

    private PairingResponses() {
    }

    static Map<String, Object> invitation(CoupleInvitation invitation, Map<Long, User> users) {
        Map<String, Object> dto = new HashMap<>();
        dto.put("id", invitation.getId());
        dto.put("senderId", invitation.getSenderId());
        dto.put("receiverId", invitation.getReceiverId());
        dto.put("anniversaryDate", invitation.getAnniversaryDate());
        dto.put("message", invitation.getMessage());
        dto.put("status", invitation.getStatus().name());
        dto.put("expiresAt", invitation.getExpiresAt());
        dto.put("createdAt", invitation.getCreatedAt());
        dto.put("updatedAt", invitation.getUpdatedAt());
        if (users.containsKey(invitation.getSenderId())) {
            dto.put("sender", userSummary(users.get(invitation.getSenderId())));
        }
        if (users.containsKey(invitation.getReceiverId())) {
            dto.put("receiver", userSummary(users.get(invitation.getReceiverId())));
        }
        return dto;
    }

    static List<Map<String, Object>> invitations(List<CoupleInvitation> invitations, Map<Long, User> users) {
        List<Map<String, Object>> dtos = new ArrayList<>();
        for (CoupleInvitation invitation : invitations) {
            dtos.add(invitation(invitation, users));
        }
        return dtos;
    }

    static Map<String, Object> couple(Couple couple, Map<Long, User> users) {
        Map<String, Object> dto = new HashMap<>();
        dto.put("id", couple.getId());
        dto.put("pairingCode", couple.getPairingCode());
        dto.put("anniversaryDate", couple.getAnniversaryDate());
        dto.put("status", couple.getStatus().name());
        dto.put("settings", new HashMap<>(couple.getSettings()));
        dto.put("memberIds", new ArrayList<>(couple.getMemberIds()));

        List<Map<String, Object>> members = new ArrayList<>();
        for (Long memberId : couple.getMemberIds()) {
            User member = users.get(memberId);
            if (member != null) {
                members.add(userSummary(member));
            }
        }
        dto.put("members", members);
        dto.put("createdAt", couple.getCreatedAt());
        dto.put("updatedAt", couple.getUpdatedAt());
        return dto;
    }

    static Map<String, Object> stats(CoupleStats stats) {
        Map<String, Object> dto = new HashMap<>();
        dto.put("coupleId", stats.getCoupleId());
        dto.put("relationshipDays", stats.getRelationshipDays());
        dto.put("anniversaryDate", stats.getAnniversaryDate());
        dto.put("memberCount", stats.getMemberCount());
        dto.put("status", stats.getStatus().name());
        dto.put("lastActivity", stats.getLastActivity());
        return dto;
    }

    static Map<String, Object> userSummary(User user) {
        Map<String, Object> dto = new HashMap<>();
        dto.put("id", user.getId());
        dto.put("name", user.getName());
        dto.put("email", user.getEmail());
        dto.put("avatarUrl", user.getAvatarUrl());
        return dto;
    }

    static Map<String, Object> currentUser(User user) {
        Map<String, Object> dto = userSummary(user);
        dto.put("coupleId", user.getCoupleId());
        dto.put("createdAt", user.getCreatedAt());
        return dto;
    }
}
