package com.twosome.backend.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
public class CoupleStats {

    private Long coupleId;
    private long relationshipDays;
    private LocalDate anniversaryDate;
    private int memberCount;
    private Couple.Status status;
    private LocalDateTime lastActivity;
}
