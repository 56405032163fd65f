package com.github.dimitryivaniuta.linkorganizer.link;

import com.github.dimitryivaniuta.linkorganizer.category.Category;
import com.github.dimitryivaniuta.linkorganizer.category.CategoryService;
import com.github.dimitryivaniuta.linkorganizer.error.ConflictException;
import com.github.dimitryivaniuta.linkorganizer.error.NotFoundException;
import com.github.dimitryivaniuta.linkorganizer.error.ValidationException;
import com.github.dimitryivaniuta.linkorganizer.link.LinkDtos.LinkCreateRequest;
import com.github.dimitryivaniuta.linkorganizer.link.LinkDtos.LinkResponse;
import com.github.dimitryivaniuta.linkorganizer.link.LinkDtos.LinkUpdateRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LinkService {

    static final int MIN_SEARCH_LENGTH = 2;
    static final String INVALID_URL = "Invalid URL format. Must include scheme (http/https) and domain.";

    private final LinkRepository linkRepo;
    private final CategoryService categoryService;

    /** Pinned first, then newest; optionally restricted to one category. */
    @Transactional(readOnly = true)
    public List<LinkResponse> findAll(Long categoryId) {
        List<Link> links = categoryId == null
                ? linkRepo.findAllByOrderByPinnedDescCreatedAtDescIdDesc()
                : linkRepo.findByCategory_IdOrderByPinnedDescCreatedAtDescIdDesc(categoryId);
        return links.stream().map(LinkService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public LinkResponse get(long id) {
        return toResponse(load(id));
    }

    @Transactional
    public LinkResponse create(LinkCreateRequest req) {
        String url = req.url().trim();
        requireValidUrl(url);
        Category category = req.categoryId() == null ? null : categoryService.require(req.categoryId());
        requireUnusedUrl(url);

        Link link = Link.builder()
                .title(req.title().trim())
                .url(url)
                .description(req.description())
                .category(category)
                .pinned(Boolean.TRUE.equals(req.pinned()))
                .build();
        return toResponse(saveUnique(link));
    }

    @Transactional
    public LinkResponse update(long id, LinkUpdateRequest req) {
        Link link = load(id);

        if (req.title() != null) {
            if (req.title().isBlank()) {
                throw new ValidationException("title must not be blank");
            }
            link.setTitle(req.title().trim());
        }
        if (req.url() != null) {
            String url = req.url().trim();
            requireValidUrl(url);
            if (!url.equals(link.getUrl())) {
                requireUnusedUrl(url);
                link.setUrl(url);
            }
        }
        if (req.description() != null) {
            link.setDescription(req.description());
        }
        if (req.categoryId() != null) {
            link.setCategory(categoryService.require(req.categoryId()));
        }
        if (req.pinned() != null) {
            link.setPinned(req.pinned());
        }
        return toResponse(saveUnique(link));
    }

    @Transactional
    public void delete(long id) {
        linkRepo.delete(load(id));
    }

    @Transactional
    public LinkResponse togglePin(long id) {
        Link link = load(id);
        link.togglePinned();
        return toResponse(linkRepo.saveAndFlush(link));
    }

    /** Case-insensitive substring match on the title. */
    @Transactional(readOnly = true)
    public List<LinkResponse> search(String term) {
        String t = term == null ? "" : term.trim();
        if (t.isEmpty()) {
            throw new ValidationException("Search term is required");
        }
        if (t.length() < MIN_SEARCH_LENGTH) {
            throw new ValidationException("Search term must be at least " + MIN_SEARCH_LENGTH + " characters long");
        }
        return linkRepo.searchByTitle(escapeLike(t)).stream().map(LinkService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<LinkResponse> pinned() {
        return linkRepo.findByPinnedTrueOrderByCreatedAtDescIdDesc().stream()
                .map(LinkService::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public LinkStats stats() {
        return new LinkStats(
                linkRepo.count(),
                linkRepo.countByPinnedTrue(),
                linkRepo.countByCategoryIsNull(),
                linkRepo.countPerCategoryName()
        );
    }

    static boolean isValidUrl(String url) {
        try {
            URI uri = new URI(url);
            return uri.getScheme() != null && uri.getRawAuthority() != null && !uri.getRawAuthority().isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static void requireValidUrl(String url) {
        if (!isValidUrl(url)) {
            throw new ValidationException(INVALID_URL);
        }
    }

    private void requireUnusedUrl(String url) {
        linkRepo.findByUrl(url).ifPresent(x -> {
            throw new ConflictException("Link with URL '" + url + "' already exists");
        });
    }

    private Link load(long id) {
        return linkRepo.findById(id).orElseThrow(() -> new NotFoundException("Link not found"));
    }

    private Link saveUnique(Link link) {
        try {
            return linkRepo.saveAndFlush(link);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Link with URL '" + link.getUrl() + "' already exists", e);
        }
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static LinkResponse toResponse(Link l) {
        Category c = l.getCategory();
        return new LinkResponse(
                l.getId(),
                l.getTitle(),
                l.getUrl(),
                l.getDescription(),
                c == null ? null : c.getId(),
                c == null ? null : c.getName(),
                l.isPinned(),
                l.getCreatedAt(),
                l.getUpdatedAt()
        );
    }
}
