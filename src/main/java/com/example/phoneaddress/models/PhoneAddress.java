package com.example.phoneaddress.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A phone number and the single postal address currently bound to it.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
@EqualsAndHashCode
@ToString
public class PhoneAddress {

    @NonNull
    private final String phone;

    @NonNull
    private final String address;

    public static PhoneAddress of(String phone, String address) {
        return new PhoneAddress(phone, address);
    }
}
