package com.example.phoneaddress.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * HTTP-layer payload of POST /phone-addresses. The phone format is not checked beyond its
 * length; symbols like '+', spaces or dashes are accepted as-is.
 */
public record CreatePhoneAddressHttpRequest(
        @JsonProperty("phone")
        @Schema(description = "Phone number used as a unique key in the storage.", example = "+7 999 123-45-67")
        @NotNull @Size(min = 3, max = 64) String phone,

        @JsonProperty("address")
        @Schema(description = "Physical address associated with the phone number.",
                example = "Moscow, Tverskaya street, 1")
        @NotNull @Size(min = 1, max = 1024) String address
) {}
