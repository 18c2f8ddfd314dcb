package com.mergington.hs.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.mergington.hs.core.exceptions.CustomException;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Validates request payloads against JSON schemas kept on the classpath.
 */
@Slf4j
@Service
public class PayloadValidation {

  private final JsonSchemaFactory schemaFactory =
      JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

  private final Map<String, JsonSchema> schemaCache = new ConcurrentHashMap<>();

  public void validatePayload(String fileName, JsonNode payload) {
    if (payload == null || payload.isNull()) {
      throw new CustomException(Constants.INVALID_REQUEST, "Request body is required",
          HttpStatus.BAD_REQUEST);
    }
    validateObject(schemaCache.computeIfAbsent(fileName, this::loadSchema), payload);
  }

  private JsonSchema loadSchema(String fileName) {
    try (InputStream schemaStream = getClass().getResourceAsStream(fileName)) {
      if (schemaStream == null) {
        throw new IllegalStateException("Schema not found on classpath: " + fileName);
      }
      return schemaFactory.getSchema(schemaStream);
    } catch (IOException e) {
      log.error("Failed to load schema {}", fileName, e);
      throw new IllegalStateException("Failed to load schema " + fileName, e);
    }
  }

  private void validateObject(JsonSchema schema, JsonNode objectNode) {
    Set<ValidationMessage> validationMessages = schema.validate(objectNode);
    if (!validationMessages.isEmpty()) {
      StringBuilder errorMessage = new StringBuilder("Validation error(s): \n");
      for (ValidationMessage message : validationMessages) {
        errorMessage.append(message.getMessage()).append("\n");
      }
      log.error("Validation Error {}", errorMessage);
      throw new CustomException(Constants.INVALID_REQUEST, errorMessage.toString(),
          HttpStatus.BAD_REQUEST);
    }
  }
}
