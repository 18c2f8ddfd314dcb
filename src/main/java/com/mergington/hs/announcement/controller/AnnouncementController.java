package com.mergington.hs.announcement.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.mergington.hs.announcement.service.AnnouncementService;
import com.mergington.hs.core.util.Constants;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/announcements")
public class AnnouncementController {

  @Autowired
  private AnnouncementService announcementService;

  @GetMapping("/active")
  public ResponseEntity<List<Map<String, Object>>> active() {
    return ResponseEntity.ok(announcementService.getActiveAnnouncements());
  }

  @GetMapping("/all")
  public ResponseEntity<List<Map<String, Object>>> all(
      @RequestParam(Constants.USERNAME) String username) {
    return ResponseEntity.ok(announcementService.getAllAnnouncements(username));
  }

  @GetMapping("/{id}")
  public ResponseEntity<Map<String, Object>> read(@PathVariable String id,
      @RequestParam(Constants.USERNAME) String username) {
    return ResponseEntity.ok(announcementService.readAnnouncement(id, username));
  }

  @PostMapping({"", "/"})
  public ResponseEntity<Map<String, Object>> create(@RequestBody JsonNode announcementDetails) {
    return ResponseEntity.ok(announcementService.createAnnouncement(announcementDetails));
  }

  @PutMapping("/{id}")
  public ResponseEntity<Map<String, Object>> update(@PathVariable String id,
      @RequestParam(Constants.USERNAME) String username,
      @RequestBody JsonNode announcementDetails) {
    return ResponseEntity.ok(
        announcementService.updateAnnouncement(id, username, announcementDetails));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Map<String, String>> delete(@PathVariable String id,
      @RequestParam(Constants.USERNAME) String username) {
    return ResponseEntity.ok(announcementService.deleteAnnouncement(id, username));
  }
}
