package com.github.dimitryivaniuta.linkorganizer.link;

import com.github.dimitryivaniuta.linkorganizer.category.Category;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "links")
public class Link {

    public static final int TITLE_LENGTH = 200;
    public static final int URL_LENGTH = 500;
    public static final int DESCRIPTION_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = TITLE_LENGTH)
    private String title;

    @Column(name = "url", nullable = false, unique = true, length = URL_LENGTH)
    private String url;

    @Column(name = "description", length = DESCRIPTION_LENGTH)
    private String description;

    // null = uncategorized; the FK is "on delete set null"
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private Category category;

    @Column(name = "pinned", nullable = false)
    private boolean pinned;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public void togglePinned() {
        pinned = !pinned;
    }
}
