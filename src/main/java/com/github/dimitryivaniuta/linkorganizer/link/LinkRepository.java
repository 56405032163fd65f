package com.github.dimitryivaniuta.linkorganizer.link;

import com.github.dimitryivaniuta.linkorganizer.category.Category;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LinkRepository extends JpaRepository<Link, Long> {

    Optional<Link> findByUrl(String url);

    @EntityGraph(attributePaths = "category")
    List<Link> findAllByOrderByPinnedDescCreatedAtDescIdDesc();

    @EntityGraph(attributePaths = "category")
    List<Link> findByCategory_IdOrderByPinnedDescCreatedAtDescIdDesc(Long categoryId);

    @EntityGraph(attributePaths = "category")
    List<Link> findByPinnedTrueOrderByCreatedAtDescIdDesc();

    @EntityGraph(attributePaths = "category")
    @Query("""
            select l from Link l
            where lower(l.title) like lower(concat('%', :term, '%')) escape '\\'
            order by l.pinned desc, l.createdAt desc, l.id desc
            """)
    List<Link> searchByTitle(@Param("term") String escapedTerm);

    long countByPinnedTrue();

    long countByCategoryIsNull();

    long countByCategory_Id(Long categoryId);

    @Modifying(flushAutomatically = true)
    @Query("update Link l set l.category = null where l.category = :category")
    int clearCategory(@Param("category") Category category);

    @Query("""
            select new com.github.dimitryivaniuta.linkorganizer.link.CategoryLinks(c.name, count(l.id))
            from Category c left join Link l on l.category = c
            group by c.name
            order by c.name
            """)
    List<CategoryLinks> countPerCategoryName();
}
