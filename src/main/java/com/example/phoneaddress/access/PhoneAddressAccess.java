package com.example.phoneaddress.access;

import java.util.Optional;

/**
 * Storage port for phone-address pairs. Implementations hold no business rules; a missing
 * phone is reported through the return value, while store failures propagate as
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface PhoneAddressAccess {

    Optional<String> findAddress(String phone);

    /**
     * Stores the address, overwriting any existing value.
     */
    void save(String phone, String address);

    /**
     * Stores the address only when no value exists for the phone yet.
     *
     * @return true if the value was written, false if the phone was already present
     */
    boolean saveIfAbsent(String phone, String address);

    boolean exists(String phone);

    /**
     * @return true if a stored value was actually removed
     */
    boolean delete(String phone);

    /**
     * Round-trips a PING to the store. Used by the health endpoint.
     */
    boolean ping();
}
