package com.appraisehub.backend.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers captured for one half (self or manager) of an evaluation.
 * Stored as versioned JSON; see {@link ResponseSetConverter} for the upgrade
 * path from unversioned payloads.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResponseSet {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    private Integer schemaVersion = CURRENT_SCHEMA_VERSION;
    private List<Answer> answers = new ArrayList<>();
    private String remarks;

    public static ResponseSet of(List<Answer> answers, String remarks) {
        return new ResponseSet(CURRENT_SCHEMA_VERSION, new ArrayList<>(answers), remarks);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Answer {
        private String questionKey;   // template question id, or legacy field name
        private Integer rating;       // optional numeric score
        private String comment;
    }
}
