package com.infound.creatorportal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a request rejected by the access-token gate.
 *
 * @param detail the rejection reason, e.g. {@code "No AccessToken"}
 */
public record ErrorDetail(@JsonProperty("detail") String detail) {
}
