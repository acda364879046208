package com.example.scvl.repository;

import com.example.scvl.model.Ogp;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OgpRepository extends JpaRepository<Ogp, Long> {
    Optional<Ogp> findByPageId(Long pageId);
}
