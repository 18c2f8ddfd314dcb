package com.mergington.hs.announcement.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

public interface AnnouncementService {

  List<Map<String, Object>> getActiveAnnouncements();

  List<Map<String, Object>> getAllAnnouncements(String username);

  Map<String, Object> readAnnouncement(String id, String username);

  Map<String, Object> createAnnouncement(JsonNode announcementDetails);

  Map<String, Object> updateAnnouncement(String id, String username, JsonNode announcementDetails);

  Map<String, String> deleteAnnouncement(String id, String username);
}
