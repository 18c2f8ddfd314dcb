package com.mergington.hs.teacher.service.impl;

import com.mergington.hs.core.exceptions.CustomException;
import com.mergington.hs.core.util.Constants;
import com.mergington.hs.teacher.entity.TeacherEntity;
import com.mergington.hs.teacher.repository.TeacherRepository;
import com.mergington.hs.teacher.service.TeacherService;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TeacherServiceImpl implements TeacherService {

  @Autowired
  private TeacherRepository teacherRepository;

  @Override
  public Optional<TeacherEntity> findTeacher(String username) {
    if (StringUtils.isBlank(username)) {
      return Optional.empty();
    }
    return teacherRepository.findById(username);
  }

  @Override
  public void validateTeacher(String username) {
    if (!findTeacher(username).isPresent()) {
      log.warn("TeacherServiceImpl::validateTeacher:unknown teacher {}", username);
      throw new CustomException(Constants.UNAUTHORIZED, Constants.UNAUTHORIZED_MESSAGE,
          HttpStatus.UNAUTHORIZED);
    }
  }
}
