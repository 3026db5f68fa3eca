package com.company.pmm.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserFeedback {
    private String feedbackId;
    private String interactionId;
    private String userId;
    private Instant timestamp;
    private Integer rating; // 1-5
    private String comment;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    @JsonIgnore
    public boolean isSatisfied() {
        return rating != null && rating >= 4;
    }
}
