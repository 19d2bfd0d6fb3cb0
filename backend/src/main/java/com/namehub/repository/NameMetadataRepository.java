package com.namehub.repository;

import com.namehub.model.NameMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NameMetadataRepository extends JpaRepository<NameMetadata, String> {
}
