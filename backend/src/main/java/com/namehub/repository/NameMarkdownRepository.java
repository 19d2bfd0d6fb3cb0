package com.namehub.repository;

import com.namehub.model.NameMarkdown;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NameMarkdownRepository extends JpaRepository<NameMarkdown, String> {
}
