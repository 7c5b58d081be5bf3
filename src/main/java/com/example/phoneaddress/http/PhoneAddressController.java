package com.example.phoneaddress.http;

import com.example.phoneaddress.models.PhoneAddress;
import com.example.phoneaddress.requests.CreatePhoneAddressHttpRequest;
import com.example.phoneaddress.requests.PhoneAddressServiceRequest;
import com.example.phoneaddress.requests.UpdatePhoneAddressHttpRequest;
import com.example.phoneaddress.service.PhoneAddressService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for phone-address records. Payloads are validated here, turned into service
 * commands, and the service's domain errors are mapped to status codes by {@link ApiExceptionHandler}.
 * Mounted under the configured API prefix by {@code ApiPathConfig}.
 */
@RestController
@RequestMapping("/phone-addresses")
@Tag(name = "Phone-address management")
public class PhoneAddressController {

    private final PhoneAddressService phoneAddressService;

    public PhoneAddressController(PhoneAddressService phoneAddressService) {
        this.phoneAddressService = phoneAddressService;
    }

    @GetMapping("/{phone}")
    @Operation(summary = "Get address by phone number")
    @ApiResponse(responseCode = "404", description = "Phone number was not found in the storage.")
    public ResponseEntity<PhoneAddressResponse> getPhoneAddress(
            @Parameter(description = "Phone number to look up.") @PathVariable String phone
    ) {
        PhoneAddress record = phoneAddressService.getRecord(phone);
        return ResponseEntity.ok(PhoneAddressResponse.from(record));
    }

    @PostMapping
    @Operation(summary = "Create new phone-address record")
    @ApiResponse(responseCode = "409", description = "Phone number already exists and cannot be created again.")
    public ResponseEntity<PhoneAddressResponse> createPhoneAddress(
            @Valid @RequestBody CreatePhoneAddressHttpRequest request
    ) {
        PhoneAddress record = phoneAddressService.createRecord(
                new PhoneAddressServiceRequest(request.phone(), request.address()));
        return ResponseEntity.status(HttpStatus.CREATED).body(PhoneAddressResponse.from(record));
    }

    @PutMapping("/{phone}")
    @Operation(summary = "Update existing phone-address record")
    @ApiResponse(responseCode = "404", description = "Phone number not found; nothing to update.")
    public ResponseEntity<PhoneAddressResponse> updatePhoneAddress(
            @Parameter(description = "Phone number whose address should be updated.") @PathVariable String phone,
            @Valid @RequestBody UpdatePhoneAddressHttpRequest request
    ) {
        PhoneAddress record = phoneAddressService.updateRecord(
                new PhoneAddressServiceRequest(phone, request.address()));
        return ResponseEntity.ok(PhoneAddressResponse.from(record));
    }

    @DeleteMapping("/{phone}")
    @Operation(summary = "Delete phone-address record")
    @ApiResponse(responseCode = "204", description = "Record was successfully deleted.")
    @ApiResponse(responseCode = "404", description = "Phone number not found; nothing to delete.")
    public ResponseEntity<Void> deletePhoneAddress(
            @Parameter(description = "Phone number whose record should be deleted.") @PathVariable String phone
    ) {
        phoneAddressService.deleteRecord(phone);
        return ResponseEntity.noContent().build();
    }
}
