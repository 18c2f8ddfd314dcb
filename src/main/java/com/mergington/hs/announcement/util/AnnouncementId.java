package com.mergington.hs.announcement.util;

import com.mergington.hs.core.exceptions.CustomException;
import com.mergington.hs.core.util.Constants;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;

/**
 * Identifier of a stored announcement. Rendered at the API boundary in the
 * lower-case canonical UUID form.
 */
@EqualsAndHashCode
public final class AnnouncementId {

  private static final Pattern CANONICAL_FORM = Pattern.compile(
      "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  private final UUID value;

  private AnnouncementId(UUID value) {
    this.value = Objects.requireNonNull(value, "value");
  }

  public static AnnouncementId generate() {
    return new AnnouncementId(UUID.randomUUID());
  }

  /**
   * Parses a client supplied identifier.
   *
   * @throws CustomException with status 400 when {@code raw} is not a canonical UUID
   */
  public static AnnouncementId parse(String raw) {
    if (raw == null || !CANONICAL_FORM.matcher(raw).matches()) {
      throw new CustomException(Constants.INVALID_ARGUMENT, Constants.INVALID_ANNOUNCEMENT_ID,
          HttpStatus.BAD_REQUEST);
    }
    return new AnnouncementId(UUID.fromString(raw));
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
