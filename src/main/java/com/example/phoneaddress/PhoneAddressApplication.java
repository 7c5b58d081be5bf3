package com.example.phoneaddress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhoneAddressApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhoneAddressApplication.class, args);
    }
}
