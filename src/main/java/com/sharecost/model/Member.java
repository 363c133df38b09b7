package com.sharecost.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "members")
@Getter
@Setter
public class Member {
  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "group_id")
  private ShareGroup group;

  @Column(nullable = false)
  private String name;

  @Column
  private String paypalEmail;

  @Column(length = 64)
  private String iban;

  /** Position in the group's member list; members are listed in join order. */
  @Column(nullable = false)
  private int joinIndex;

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
