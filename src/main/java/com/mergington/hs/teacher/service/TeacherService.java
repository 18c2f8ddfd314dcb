package com.mergington.hs.teacher.service;

import com.mergington.hs.teacher.entity.TeacherEntity;
import java.util.Optional;

/**
 * Read-only view of the teacher directory. Only used to decide whether a
 * username belongs to a known teacher.
 */
public interface TeacherService {

  Optional<TeacherEntity> findTeacher(String username);

  /**
   * Fails with 401 unless {@code username} is a known teacher.
   */
  void validateTeacher(String username);
}
