package com.mergington.hs.core.util;

import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Getter
@Setter
public class HsServerProperties {

  @Value("${school.time.zone:}")
  private String schoolTimeZone;

  @Value("${announcement.payload.create.schema}")
  private String announcementCreateSchema;

  @Value("${announcement.payload.update.schema}")
  private String announcementUpdateSchema;

  public ZoneId getSchoolZoneId() {
    if (StringUtils.isBlank(schoolTimeZone)) {
      return ZoneId.systemDefault();
    }
    return ZoneId.of(schoolTimeZone.trim());
  }
}
