package com.github.dimitryivaniuta.linkorganizer.category;

import com.github.dimitryivaniuta.linkorganizer.category.CategoryDtos.CategoryCreateRequest;
import com.github.dimitryivaniuta.linkorganizer.category.CategoryDtos.CategoryResponse;
import com.github.dimitryivaniuta.linkorganizer.category.CategoryDtos.CategoryUpdateRequest;
import com.github.dimitryivaniuta.linkorganizer.web.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/categories")
public class CategoryController {

    private final CategoryService service;

    @GetMapping
    public ApiResponse<List<CategoryResponse>> list() {
        return ApiResponse.list(service.findAll());
    }

    @GetMapping("/{categoryId}")
    public ApiResponse<CategoryResponse> get(@PathVariable("categoryId") long categoryId) {
        return ApiResponse.ok(service.get(categoryId));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<CategoryResponse> create(@Valid @RequestBody CategoryCreateRequest req) {
        return ApiResponse.ok(service.create(req), "Category created successfully");
    }

    @PutMapping("/{categoryId}")
    public ApiResponse<CategoryResponse> update(@PathVariable("categoryId") long categoryId,
                                                @Valid @RequestBody CategoryUpdateRequest req) {
        return ApiResponse.ok(service.update(categoryId, req), "Category updated successfully");
    }

    @DeleteMapping("/{categoryId}")
    public ApiResponse<Void> delete(@PathVariable("categoryId") long categoryId) {
        service.delete(categoryId);
        return ApiResponse.message("Category deleted successfully");
    }

    @GetMapping("/stats")
    public ApiResponse<CategoryStats> stats() {
        return ApiResponse.ok(service.stats());
    }
}
