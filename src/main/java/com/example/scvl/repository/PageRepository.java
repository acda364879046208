package com.example.scvl.repository;

import com.example.scvl.model.Page;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PageRepository extends JpaRepository<Page, Long> {
    Optional<Page> findBySlug(String slug);

    List<Page> findByUserIdOrderByCreatedAtDesc(Long userId);
}
