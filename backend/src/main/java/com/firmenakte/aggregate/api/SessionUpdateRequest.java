package com.firmenakte.aggregate.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionUpdateRequest(
    @JsonProperty("credential_blob") @JsonAlias("credentialBlob") String credentialBlob
) {
}
