package com.example.phoneaddress.http;

import com.example.phoneaddress.models.PhoneAddress;
import com.fasterxml.jackson.annotation.JsonProperty;

public record PhoneAddressResponse(
        @JsonProperty("phone") String phone,
        @JsonProperty("address") String address
) {

    static PhoneAddressResponse from(PhoneAddress record) {
        return new PhoneAddressResponse(record.getPhone(), record.getAddress());
    }
}
