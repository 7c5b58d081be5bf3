package com.example.phoneaddress.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.phoneaddress.access.PhoneAddressAccess;
import com.example.phoneaddress.models.PhoneAddress;
import com.example.phoneaddress.requests.PhoneAddressServiceRequest;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class PhoneAddressServiceTest {

    private InMemoryPhoneAddressAccess access;
    private PhoneAddressService service;

    @BeforeEach
    void setUp() {
        access = new InMemoryPhoneAddressAccess();
        service = new PhoneAddressService(access, false);
    }

    @Test
    @DisplayName("create stores a new record and get returns it")
    void createThenGet() {
        PhoneAddress created = service.createRecord(new PhoneAddressServiceRequest("+7 999 000-00-01", "Moscow, Test street 1"));

        assertEquals("+7 999 000-00-01", created.getPhone());
        assertEquals("Moscow, Test street 1", created.getAddress());
        assertEquals(PhoneAddress.of("+7 999 000-00-01", "Moscow, Test street 1"), service.getRecord("+7 999 000-00-01"));
    }

    @Test
    @DisplayName("second create for the same phone is a conflict and keeps the stored address")
    void createRejectsExisting() {
        service.createRecord(new PhoneAddressServiceRequest("111", "Addr1"));

        PhoneAddressException ex = assertThrows(PhoneAddressException.class,
                () -> service.createRecord(new PhoneAddressServiceRequest("111", "Addr2")));

        assertEquals(PhoneAddressException.Code.PHONE_ALREADY_EXISTS, ex.getCode());
        assertEquals("Phone number already exists.", ex.getMessage());
        assertEquals("Addr1", service.getRecord("111").getAddress());
    }

    @Test
    @DisplayName("get, update and delete report not found for unknown phones")
    void unknownPhoneIsNotFound() {
        PhoneAddressException get = assertThrows(PhoneAddressException.class, () -> service.getRecord("404"));
        PhoneAddressException update = assertThrows(PhoneAddressException.class,
                () -> service.updateRecord(new PhoneAddressServiceRequest("404", "Nowhere")));
        PhoneAddressException delete = assertThrows(PhoneAddressException.class, () -> service.deleteRecord("404"));

        assertEquals(PhoneAddressException.Code.PHONE_NOT_FOUND, get.getCode());
        assertEquals(PhoneAddressException.Code.PHONE_NOT_FOUND, update.getCode());
        assertEquals(PhoneAddressException.Code.PHONE_NOT_FOUND, delete.getCode());
        assertTrue(access.snapshot().isEmpty(), "update must not create the record implicitly");
    }

    @Test
    @DisplayName("update replaces the address of an existing record")
    void updateReplacesAddress() {
        service.createRecord(new PhoneAddressServiceRequest("333", "Old"));

        PhoneAddress updated = service.updateRecord(new PhoneAddressServiceRequest("333", "New Address"));

        assertEquals("New Address", updated.getAddress());
        assertEquals("New Address", service.getRecord("333").getAddress());
        assertEquals(Map.of("333", "New Address"), access.snapshot());
    }

    @Test
    @DisplayName("delete removes the record; deleting again is not found")
    void deleteIsNotIdempotentInOutcome() {
        service.createRecord(new PhoneAddressServiceRequest("444", "Addr"));

        service.deleteRecord("444");

        assertFalse(access.exists("444"));
        PhoneAddressException again = assertThrows(PhoneAddressException.class, () -> service.deleteRecord("444"));
        assertEquals(PhoneAddressException.Code.PHONE_NOT_FOUND, again.getCode());
    }

    @Test
    @DisplayName("store failures propagate unchanged")
    void storeFailurePropagates() {
        PhoneAddressAccess failing = mock(PhoneAddressAccess.class);
        when(failing.findAddress(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        PhoneAddressService failingService = new PhoneAddressService(failing, false);

        assertThrows(RedisConnectionFailureException.class, () -> failingService.getRecord("123"));
    }

    @Nested
    class NormalizedKeys {

        @BeforeEach
        void enableNormalization() {
            service = new PhoneAddressService(access, true);
        }

        @Test
        @DisplayName("different spellings of one number address the same record")
        void spellingsShareRecord() {
            service.createRecord(new PhoneAddressServiceRequest("+7 (999) 123-45-67", "Moscow"));

            PhoneAddress found = service.getRecord("79991234567");

            assertEquals("79991234567", found.getPhone());
            assertEquals("Moscow", found.getAddress());
            assertEquals(Map.of("79991234567", "Moscow"), access.snapshot());
            assertThrows(PhoneAddressException.class,
                    () -> service.createRecord(new PhoneAddressServiceRequest("7-999-123-4567", "Other")));
        }

        @Test
        @DisplayName("phones without digits are rejected before touching the store")
        void phoneWithoutDigitsIsInvalid() {
            PhoneAddressAccess guarded = mock(PhoneAddressAccess.class);
            PhoneAddressService guardedService = new PhoneAddressService(guarded, true);

            PhoneAddressException ex = assertThrows(PhoneAddressException.class,
                    () -> guardedService.createRecord(new PhoneAddressServiceRequest("---+++", "Addr")));

            assertEquals(PhoneAddressException.Code.INVALID_PHONE, ex.getCode());
            verify(guarded, never()).saveIfAbsent(anyString(), anyString());
        }
    }
}
