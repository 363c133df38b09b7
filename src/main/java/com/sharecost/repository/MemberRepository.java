package com.sharecost.repository;

import com.sharecost.model.Member;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {
  @Query("select m from Member m where m.group.id = :groupId order by m.joinIndex asc, m.createdAt asc")
  List<Member> findByGroupId(@Param("groupId") UUID groupId);

  @Query("select m from Member m where m.id = :memberId and m.group.id = :groupId")
  Optional<Member> findByIdAndGroupId(@Param("memberId") UUID memberId, @Param("groupId") UUID groupId);

  @Query("select coalesce(max(m.joinIndex), -1) from Member m where m.group.id = :groupId")
  int findMaxJoinIndex(@Param("groupId") UUID groupId);
}
