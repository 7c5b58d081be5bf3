package com.example.phoneaddress.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * HTTP-layer payload of PUT /phone-addresses/{phone}. Only the address can change.
 */
public record UpdatePhoneAddressHttpRequest(
        @JsonProperty("address")
        @Schema(description = "New address for the phone number.", example = "Moscow, Tverskaya street, 2")
        @NotNull @Size(min = 1, max = 1024) String address
) {}
