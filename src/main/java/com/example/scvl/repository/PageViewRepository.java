package com.example.scvl.repository;

import com.example.scvl.model.PageView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PageViewRepository extends JpaRepository<PageView, Long> {

    @Query("SELECT v.slug, COUNT(v) FROM PageView v WHERE v.slug IN :slugs GROUP BY v.slug")
    List<Object[]> countViewsBySlugs(@Param("slugs") Collection<String> slugs);
}
