package com.mergington.hs.announcement.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.mergington.hs.core.util.Constants;
import org.apache.commons.lang3.StringUtils;

/**
 * Decides whether an announcement document is visible on a given day.
 * Dates are compared as {@code YYYY-MM-DD} strings, which order the same way
 * as the dates they spell.
 */
public class ActiveAnnouncementFilter {

  private ActiveAnnouncementFilter() {
  }

  public static boolean isActive(JsonNode announcement, String currentDate) {
    return hasNotExpired(announcement, currentDate) && hasStarted(announcement, currentDate);
  }

  public static boolean hasNotExpired(JsonNode announcement, String currentDate) {
    String expirationDate = textOf(announcement, Constants.EXPIRATION_DATE);
    return expirationDate != null && expirationDate.compareTo(currentDate) >= 0;
  }

  // a missing or blank start date means the announcement is already running
  public static boolean hasStarted(JsonNode announcement, String currentDate) {
    String startDate = textOf(announcement, Constants.START_DATE);
    return StringUtils.isEmpty(startDate) || startDate.compareTo(currentDate) <= 0;
  }

  private static String textOf(JsonNode announcement, String field) {
    if (announcement == null) {
      return null;
    }
    JsonNode value = announcement.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }
}
