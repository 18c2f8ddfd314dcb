package com.mergington.hs.teacher.entity;

import javax.persistence.Column;
import javax.persistence.Entity;
import javax.persistence.Id;
import javax.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "teacher")
@Entity
public class TeacherEntity {
  @Id
  private String username;

  @Column(name = "display_name")
  private String displayName;

  private String role;
}
