package com.example.phoneaddress.requests;

import java.util.Objects;

/**
 * Service-layer command for create and update, built from the HTTP payload (and, for updates,
 * the path variable).
 */
public record PhoneAddressServiceRequest(
        String phone,
        String address
) {

    public PhoneAddressServiceRequest {
        Objects.requireNonNull(phone, "phone");
        if (phone.isBlank()) {
            throw new IllegalArgumentException("phone must be non-blank");
        }

        Objects.requireNonNull(address, "address");
        if (address.isEmpty()) {
            throw new IllegalArgumentException("address must be non-empty");
        }
    }
}
