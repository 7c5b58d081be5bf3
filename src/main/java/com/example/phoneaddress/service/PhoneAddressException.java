package com.example.phoneaddress.service;

import lombok.Getter;

public class PhoneAddressException extends RuntimeException {

    public enum Code {
        PHONE_NOT_FOUND,
        PHONE_ALREADY_EXISTS,
        INVALID_PHONE
    }

    @Getter
    private final Code code;

    private PhoneAddressException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static PhoneAddressException phoneNotFound() {
        return new PhoneAddressException(Code.PHONE_NOT_FOUND, "Phone number not found.");
    }

    public static PhoneAddressException phoneAlreadyExists() {
        return new PhoneAddressException(Code.PHONE_ALREADY_EXISTS, "Phone number already exists.");
    }

    public static PhoneAddressException invalidPhone(String phone) {
        return new PhoneAddressException(Code.INVALID_PHONE,
                "Phone number '" + phone + "' contains no digits.");
    }
}
