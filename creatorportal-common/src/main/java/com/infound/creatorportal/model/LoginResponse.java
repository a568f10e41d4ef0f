package com.infound.creatorportal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned by a successful login.
 * <p>
 * Used by: {@code POST /account/login} response (inside {@link ApiResponse#data()})
 *
 * @param jti    the session id embedded in the token
 * @param header the request header the client must send the token in
 * @param token  the signed access token
 */
public record LoginResponse(
    @JsonProperty("jti") String jti,
    @JsonProperty("header") String header,
    @JsonProperty("token") String token) {
}
