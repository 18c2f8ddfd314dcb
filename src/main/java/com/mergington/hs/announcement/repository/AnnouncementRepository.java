package com.mergington.hs.announcement.repository;

import com.mergington.hs.announcement.entity.AnnouncementEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AnnouncementRepository extends JpaRepository<AnnouncementEntity, String> {

  @Query(value = "SELECT * FROM announcement WHERE data->>'expiration_date' >= :currentDate", nativeQuery = true)
  List<AnnouncementEntity> findNotExpired(@Param("currentDate") String currentDate);

  List<AnnouncementEntity> findAllByOrderByCreatedOnDesc();

  /**
   * Merges {@code changes} (a JSON object) into the stored document.
   *
   * @return number of rows matched, 0 when no announcement has this id
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(value = "UPDATE announcement SET data = data || CAST(:changes AS jsonb) WHERE announcement_id = :announcementId", nativeQuery = true)
  int mergeData(@Param("announcementId") String announcementId, @Param("changes") String changes);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM AnnouncementEntity a WHERE a.announcementId = :announcementId")
  int deleteByAnnouncementId(@Param("announcementId") String announcementId);
}
