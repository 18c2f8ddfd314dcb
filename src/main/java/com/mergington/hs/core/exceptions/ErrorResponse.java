package com.mergington.hs.core.exceptions;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ErrorResponse {
    String code;
    String message;
    int httpStatusCode;
}
