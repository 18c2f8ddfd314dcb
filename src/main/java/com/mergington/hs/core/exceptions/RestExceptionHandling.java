package com.mergington.hs.core.exceptions;

import com.mergington.hs.core.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class RestExceptionHandling {

    @ExceptionHandler(CustomException.class)
    public ResponseEntity<ErrorResponse> handleCustomException(CustomException ex) {
        HttpStatus status = ex.getHttpStatusCode() != null
                ? ex.getHttpStatusCode()
                : HttpStatus.BAD_REQUEST;
        if (StringUtils.isNotBlank(ex.getMessage())) {
            log.error("RestExceptionHandling::handleCustomException:{} {}", ex.getCode(), ex.getMessage());
        }
        return buildResponse(ex.getCode(), ex.getMessage(), status);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.error("RestExceptionHandling::handleBadRequest:{}", ex.getMessage());
        return buildResponse(Constants.INVALID_REQUEST, ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        log.error("RestExceptionHandling::handleException", ex);
        return buildResponse(Constants.ERROR, ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> buildResponse(String code, String message, HttpStatus status) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .code(code)
                .message(message)
                .httpStatusCode(status.value())
                .build();
        return new ResponseEntity<>(errorResponse, status);
    }

}
