package com.github.dimitryivaniuta.linkorganizer.category;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface CategoryRepository extends JpaRepository<Category, Long> {

    Optional<Category> findByName(String name);

    List<Category> findAllByOrderByNameAsc();

    @Query("""
            select new com.github.dimitryivaniuta.linkorganizer.category.CategoryLinkCount(c.id, c.name, count(l.id))
            from Category c left join Link l on l.category = c
            group by c.id, c.name
            order by c.name
            """)
    List<CategoryLinkCount> countLinksPerCategory();
}
