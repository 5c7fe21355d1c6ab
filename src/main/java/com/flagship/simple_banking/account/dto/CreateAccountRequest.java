package com.flagship.simple_banking.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request DTO for creating an account.
 */
@Value
public class CreateAccountRequest {

    @NotBlank(message = "document_number is required")
    @Size(min = 11, max = 14, message = "document_number must have between 11 and 14 characters")
    @Pattern(regexp = "^\\d*$", message = "document_number must contain only digits")
    @JsonProperty("document_number")
    String documentNumber;
}
