package com.github.dimitryivaniuta.linkorganizer.category;

import com.github.dimitryivaniuta.linkorganizer.category.CategoryDtos.CategoryCreateRequest;
import com.github.dimitryivaniuta.linkorganizer.category.CategoryDtos.CategoryResponse;
import com.github.dimitryivaniuta.linkorganizer.category.CategoryDtos.CategoryUpdateRequest;
import com.github.dimitryivaniuta.linkorganizer.error.ConflictException;
import com.github.dimitryivaniuta.linkorganizer.error.NotFoundException;
import com.github.dimitryivaniuta.linkorganizer.error.ValidationException;
import com.github.dimitryivaniuta.linkorganizer.link.LinkRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepo;
    private final LinkRepository linkRepo;

    @Transactional(readOnly = true)
    public List<CategoryResponse> findAll() {
        Map<Long, Long> counts = categoryRepo.countLinksPerCategory().stream()
                .collect(Collectors.toMap(CategoryLinkCount::id, CategoryLinkCount::linksCount));
        return categoryRepo.findAllByOrderByNameAsc().stream()
                .map(c -> toResponse(c, counts.getOrDefault(c.getId(), 0L)))
                .toList();
    }

    @Transactional(readOnly = true)
    public CategoryResponse get(long id) {
        Category c = load(id);
        return toResponse(c, linkRepo.countByCategory_Id(id));
    }

    @Transactional
    public CategoryResponse create(CategoryCreateRequest req) {
        String name = req.name().trim();
        categoryRepo.findByName(name).ifPresent(x -> {
            throw new ConflictException("Category '" + name + "' already exists");
        });

        Category c = Category.builder()
                .name(name)
                .description(req.description())
                .build();
        return toResponse(saveUnique(c), 0);
    }

    @Transactional
    public CategoryResponse update(long id, CategoryUpdateRequest req) {
        Category c = load(id);

        if (req.name() != null) {
            String name = req.name().trim();
            if (name.isEmpty()) {
                throw new ValidationException("name must not be blank");
            }
            if (!name.equals(c.getName())) {
                categoryRepo.findByName(name).ifPresent(x -> {
                    throw new ConflictException("Category '" + name + "' already exists");
                });
                c.setName(name);
            }
        }
        if (req.description() != null) {
            c.setDescription(req.description());
        }
        return toResponse(saveUnique(c), linkRepo.countByCategory_Id(id));
    }

    /** Links of a deleted category become uncategorized. */
    @Transactional
    public void delete(long id) {
        Category c = load(id);
        linkRepo.clearCategory(c);
        categoryRepo.delete(c);
    }

    @Transactional(readOnly = true)
    public CategoryStats stats() {
        return new CategoryStats(categoryRepo.count(), categoryRepo.countLinksPerCategory());
    }

    @Transactional(readOnly = true)
    public Category require(long id) {
        return categoryRepo.findById(id)
                .orElseThrow(() -> new ValidationException("Category with ID " + id + " does not exist"));
    }

    private Category load(long id) {
        return categoryRepo.findById(id)
                .orElseThrow(() -> new NotFoundException("Category not found"));
    }

    private Category saveUnique(Category c) {
        try {
            return categoryRepo.saveAndFlush(c);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent insert of the same name
            throw new ConflictException("Category '" + c.getName() + "' already exists", e);
        }
    }

    private static CategoryResponse toResponse(Category c, long linksCount) {
        return new CategoryResponse(
                c.getId(),
                c.getName(),
                c.getDescription(),
                c.getCreatedAt(),
                c.getUpdatedAt(),
                linksCount
        );
    }
}
