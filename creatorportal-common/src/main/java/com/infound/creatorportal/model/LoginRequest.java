package com.infound.creatorportal.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a creator login.
 * <p>
 * Creators log in with the sample id they received together with their platform username.
 * <p>
 * Used by: {@code POST /account/login}
 *
 * @param sampleId the sample id, also accepted as {@code sampleId}
 * @param userName the platform username, also accepted as {@code username}
 */
public record LoginRequest(
    @JsonProperty("sampleID") @JsonAlias({"sampleId", "sample_id"}) String sampleId,
    @JsonProperty("userName") @JsonAlias({"username", "user_name"}) String userName) {
}
