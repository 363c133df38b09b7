package com.sharecost.repository;

import com.sharecost.model.ShareGroup;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ShareGroupRepository extends JpaRepository<ShareGroup, UUID> {}
