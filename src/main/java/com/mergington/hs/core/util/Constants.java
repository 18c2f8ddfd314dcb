package com.mergington.hs.core.util;

public class Constants {

  private Constants() {
  }

  public static final String ID = "_id";
  public static final String MESSAGE = "message";
  public static final String START_DATE = "start_date";
  public static final String EXPIRATION_DATE = "expiration_date";
  public static final String CREATED_BY = "created_by";
  public static final String CREATED_AT = "created_at";
  public static final String USERNAME = "username";

  public static final String ERROR = "ERROR";
  public static final String UNAUTHORIZED = "UNAUTHORIZED";
  public static final String INVALID_REQUEST = "INVALID_REQUEST";
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  public static final String NOT_FOUND = "NOT_FOUND";

  public static final String UNAUTHORIZED_MESSAGE = "Unauthorized";
  public static final String NO_FIELDS_TO_UPDATE = "No fields to update";
  public static final String INVALID_ANNOUNCEMENT_ID = "Invalid announcement ID";
  public static final String ANNOUNCEMENT_NOT_FOUND = "Announcement not found";
  public static final String ANNOUNCEMENT_DELETED = "Announcement deleted successfully";

  public static final String CREATED_AT_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSSSS";
}
