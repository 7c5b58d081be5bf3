package com.example.phoneaddress.service;

import com.example.phoneaddress.access.PhoneAddressAccess;
import com.example.phoneaddress.config.PhoneAddressProperties;
import com.example.phoneaddress.models.PhoneAddress;
import com.example.phoneaddress.requests.PhoneAddressServiceRequest;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Owns the rules for phone-address records: creation only for unknown phones, updates and
 * deletes only for known ones. Storage is delegated to {@link PhoneAddressAccess}; store
 * failures pass through untouched.
 */
@Service
@Slf4j
public class PhoneAddressService {

    private final PhoneAddressAccess access;
    private final boolean normalizeKeys;

    @Autowired
    public PhoneAddressService(PhoneAddressAccess access, PhoneAddressProperties properties) {
        this(access, properties.normalizePhoneKeys());
    }

    public PhoneAddressService(PhoneAddressAccess access, boolean normalizeKeys) {
        this.access = access;
        this.normalizeKeys = normalizeKeys;
    }

    public PhoneAddress getRecord(String phone) {
        Objects.requireNonNull(phone, "phone");
        String address = access.findAddress(storageKey(phone))
                .orElseThrow(PhoneAddressException::phoneNotFound);
        log.debug("Found address for phone {}", phone);
        return PhoneAddress.of(phone, address);
    }

    /**
     * Creates the record through the store's set-if-absent, so two concurrent creates for the
     * same phone cannot both succeed.
     */
    public PhoneAddress createRecord(PhoneAddressServiceRequest request) {
        Objects.requireNonNull(request, "request");
        if (!access.saveIfAbsent(storageKey(request.phone()), request.address())) {
            log.info("Rejected create for existing phone {}", request.phone());
            throw PhoneAddressException.phoneAlreadyExists();
        }
        log.info("Created address for phone {}", request.phone());
        return PhoneAddress.of(request.phone(), request.address());
    }

    /**
     * Replaces the address of an existing record. The existence check and the write are two
     * separate store calls; a delete landing in between is overwritten by this update.
     */
    public PhoneAddress updateRecord(PhoneAddressServiceRequest request) {
        Objects.requireNonNull(request, "request");
        String key = storageKey(request.phone());
        if (!access.exists(key)) {
            log.info("Rejected update for unknown phone {}", request.phone());
            throw PhoneAddressException.phoneNotFound();
        }
        access.save(key, request.address());
        log.info("Updated address for phone {}", request.phone());
        return PhoneAddress.of(request.phone(), request.address());
    }

    public void deleteRecord(String phone) {
        Objects.requireNonNull(phone, "phone");
        if (!access.delete(storageKey(phone))) {
            log.info("Rejected delete for unknown phone {}", phone);
            throw PhoneAddressException.phoneNotFound();
        }
        log.info("Deleted address for phone {}", phone);
    }

    private String storageKey(String phone) {
        if (!normalizeKeys) {
            return phone;
        }
        String digits = PhoneNumbers.normalize(phone);
        if (digits.isEmpty()) {
            throw PhoneAddressException.invalidPhone(phone);
        }
        return digits;
    }
}
