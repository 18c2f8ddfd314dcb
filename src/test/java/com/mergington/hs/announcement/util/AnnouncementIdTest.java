package com.mergington.hs.announcement.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.mergington.hs.core.exceptions.CustomException;
import com.mergington.hs.core.util.Constants;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class AnnouncementIdTest {

  @Test
  void parseAcceptsCanonicalUuidAndRendersLowerCase() {
    AnnouncementId id = AnnouncementId.parse("3F2504E0-4F89-11D3-9A0C-0305E82C3301");

    assertEquals("3f2504e0-4f89-11d3-9a0c-0305e82c3301", id.toString());
    assertEquals(id, AnnouncementId.parse("3f2504e0-4f89-11d3-9a0c-0305e82c3301"));
  }

  @Test
  void generatedIdsParseBackToThemselves() {
    AnnouncementId id = AnnouncementId.generate();

    assertEquals(id, AnnouncementId.parse(id.toString()));
    assertNotEquals(id, AnnouncementId.generate());
  }

  @Test
  void parseRejectsMalformedIdentifiers() {
    for (String raw : new String[] {null, "", "not-an-id", "507f1f77bcf86cd799439011",
        "1-1-1-1-1", "3f2504e0-4f89-11d3-9a0c-0305e82c3301x",
        " 3f2504e0-4f89-11d3-9a0c-0305e82c3301", "3f2504e0-4f89-11d3-9a0c-0305e82c3301\n"}) {
      CustomException ex = assertThrows(CustomException.class, () -> AnnouncementId.parse(raw));
      assertEquals(Constants.INVALID_ARGUMENT, ex.getCode());
      assertEquals(Constants.INVALID_ANNOUNCEMENT_ID, ex.getMessage());
      assertEquals(HttpStatus.BAD_REQUEST, ex.getHttpStatusCode());
    }
  }
}
