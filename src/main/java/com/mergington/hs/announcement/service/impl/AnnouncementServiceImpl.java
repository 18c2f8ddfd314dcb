package com.mergington.hs.announcement.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mergington.hs.announcement.entity.AnnouncementEntity;
import com.mergington.hs.announcement.repository.AnnouncementRepository;
import com.mergington.hs.announcement.service.AnnouncementService;
import com.mergington.hs.announcement.util.ActiveAnnouncementFilter;
import com.mergington.hs.announcement.util.AnnouncementId;
import com.mergington.hs.core.exceptions.CustomException;
import com.mergington.hs.core.util.Constants;
import com.mergington.hs.core.util.HsServerProperties;
import com.mergington.hs.core.util.PayloadValidation;
import com.mergington.hs.teacher.service.TeacherService;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Slf4j
public class AnnouncementServiceImpl implements AnnouncementService {

  private static final List<String> UPDATABLE_FIELDS =
      Arrays.asList(Constants.MESSAGE, Constants.START_DATE, Constants.EXPIRATION_DATE);

  private static final DateTimeFormatter CREATED_AT_FORMAT =
      DateTimeFormatter.ofPattern(Constants.CREATED_AT_PATTERN);

  @Autowired
  private AnnouncementRepository announcementRepository;

  @Autowired
  private TeacherService teacherService;

  @Autowired
  private PayloadValidation payloadValidation;

  @Autowired
  private HsServerProperties serverProperties;

  @Autowired
  private ObjectMapper objectMapper;

  @Autowired
  private Clock clock;

  @Override
  public List<Map<String, Object>> getActiveAnnouncements() {
    String currentDate = LocalDate.now(clock).toString();
    log.info("AnnouncementServiceImpl::getActiveAnnouncements:currentDate {}", currentDate);
    return announcementRepository.findNotExpired(currentDate).stream()
        .filter(entity -> ActiveAnnouncementFilter.isActive(entity.getData(), currentDate))
        .map(this::toResponse)
        .collect(Collectors.toList());
  }

  @Override
  public List<Map<String, Object>> getAllAnnouncements(String username) {
    log.info("AnnouncementServiceImpl::getAllAnnouncements:inside");
    teacherService.validateTeacher(username);
    return announcementRepository.findAllByOrderByCreatedOnDesc().stream()
        .map(this::toResponse)
        .collect(Collectors.toList());
  }

  @Override
  public Map<String, Object> readAnnouncement(String id, String username) {
    log.info("AnnouncementServiceImpl::readAnnouncement:inside");
    teacherService.validateTeacher(username);
    AnnouncementId announcementId = AnnouncementId.parse(id);
    return toResponse(fetchAnnouncement(announcementId));
  }

  @Override
  public Map<String, Object> createAnnouncement(JsonNode announcementDetails) {
    log.info("AnnouncementServiceImpl::createAnnouncement:inside");
    payloadValidation.validatePayload(serverProperties.getAnnouncementCreateSchema(),
        announcementDetails);
    String createdBy = announcementDetails.get(Constants.CREATED_BY).asText();
    teacherService.validateTeacher(createdBy);

    LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    ObjectNode data = objectMapper.createObjectNode();
    data.put(Constants.MESSAGE, announcementDetails.get(Constants.MESSAGE).asText());
    JsonNode startDate = announcementDetails.get(Constants.START_DATE);
    if (startDate == null || startDate.isNull()) {
      data.putNull(Constants.START_DATE);
    } else {
      data.put(Constants.START_DATE, startDate.asText());
    }
    data.put(Constants.EXPIRATION_DATE,
        announcementDetails.get(Constants.EXPIRATION_DATE).asText());
    data.put(Constants.CREATED_BY, createdBy);
    data.put(Constants.CREATED_AT, now.format(CREATED_AT_FORMAT));

    AnnouncementEntity entity = new AnnouncementEntity();
    entity.setAnnouncementId(AnnouncementId.generate().toString());
    entity.setData(data);
    entity.setCreatedOn(Timestamp.valueOf(now));
    AnnouncementEntity savedEntity = announcementRepository.save(entity);
    log.info("AnnouncementServiceImpl::createAnnouncement:created {} by {}",
        savedEntity.getAnnouncementId(), createdBy);
    return toResponse(savedEntity);
  }

  @Override
  @Transactional
  public Map<String, Object> updateAnnouncement(String id, String username,
      JsonNode announcementDetails) {
    log.info("AnnouncementServiceImpl::updateAnnouncement:inside");
    payloadValidation.validatePayload(serverProperties.getAnnouncementUpdateSchema(),
        announcementDetails);
    teacherService.validateTeacher(username);

    ObjectNode changes = objectMapper.createObjectNode();
    for (String field : UPDATABLE_FIELDS) {
      JsonNode value = announcementDetails.get(field);
      if (value != null && !value.isNull()) {
        changes.set(field, value);
      }
    }
    if (changes.size() == 0) {
      throw new CustomException(Constants.INVALID_REQUEST, Constants.NO_FIELDS_TO_UPDATE,
          HttpStatus.BAD_REQUEST);
    }

    AnnouncementId announcementId = AnnouncementId.parse(id);
    int matched = announcementRepository.mergeData(announcementId.toString(), changes.toString());
    if (matched == 0) {
      throw notFound(announcementId);
    }
    AnnouncementEntity updatedEntity = fetchAnnouncement(announcementId);
    log.info("AnnouncementServiceImpl::updateAnnouncement:updated {}", announcementId);
    return toResponse(updatedEntity);
  }

  @Override
  @Transactional
  public Map<String, String> deleteAnnouncement(String id, String username) {
    log.info("AnnouncementServiceImpl::deleteAnnouncement:inside");
    teacherService.validateTeacher(username);
    AnnouncementId announcementId = AnnouncementId.parse(id);
    int deleted = announcementRepository.deleteByAnnouncementId(announcementId.toString());
    if (deleted == 0) {
      throw notFound(announcementId);
    }
    log.info("AnnouncementServiceImpl::deleteAnnouncement:deleted {}", announcementId);
    return Collections.singletonMap(Constants.MESSAGE, Constants.ANNOUNCEMENT_DELETED);
  }

  private AnnouncementEntity fetchAnnouncement(AnnouncementId announcementId) {
    return announcementRepository.findById(announcementId.toString())
        .orElseThrow(() -> notFound(announcementId));
  }

  private CustomException notFound(AnnouncementId announcementId) {
    log.error("no announcement found for {}", announcementId);
    return new CustomException(Constants.NOT_FOUND, Constants.ANNOUNCEMENT_NOT_FOUND,
        HttpStatus.NOT_FOUND);
  }

  private Map<String, Object> toResponse(AnnouncementEntity entity) {
    ObjectNode jsonNode = objectMapper.createObjectNode();
    jsonNode.put(Constants.ID, entity.getAnnouncementId());
    if (entity.getData() != null) {
      jsonNode.setAll((ObjectNode) entity.getData());
    }
    return objectMapper.convertValue(jsonNode, new TypeReference<Map<String, Object>>() {
    });
  }
}
