package com.github.dimitryivaniuta.linkorganizer.link;

import com.github.dimitryivaniuta.linkorganizer.link.LinkDtos.LinkCreateRequest;
import com.github.dimitryivaniuta.linkorganizer.link.LinkDtos.LinkResponse;
import com.github.dimitryivaniuta.linkorganizer.link.LinkDtos.LinkUpdateRequest;
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
@RequestMapping("/api/links")
public class LinkController {

    private final LinkService service;

    @GetMapping
    public ApiResponse<List<LinkResponse>> list(@RequestParam(name = "category_id", required = false) Long categoryId) {
        return ApiResponse.list(service.findAll(categoryId));
    }

    @GetMapping("/{linkId}")
    public ApiResponse<LinkResponse> get(@PathVariable("linkId") long linkId) {
        return ApiResponse.ok(service.get(linkId));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<LinkResponse> create(@Valid @RequestBody LinkCreateRequest req) {
        return ApiResponse.ok(service.create(req), "Link created successfully");
    }

    @PutMapping("/{linkId}")
    public ApiResponse<LinkResponse> update(@PathVariable("linkId") long linkId,
                                            @Valid @RequestBody LinkUpdateRequest req) {
        return ApiResponse.ok(service.update(linkId, req), "Link updated successfully");
    }

    @DeleteMapping("/{linkId}")
    public ApiResponse<Void> delete(@PathVariable("linkId") long linkId) {
        service.delete(linkId);
        return ApiResponse.message("Link deleted successfully");
    }

    @PatchMapping("/{linkId}/pin")
    public ApiResponse<LinkResponse> togglePin(@PathVariable("linkId") long linkId) {
        return ApiResponse.ok(service.togglePin(linkId), "Link pin status updated successfully");
    }

    @GetMapping("/search")
    public ApiResponse<List<LinkResponse>> search(@RequestParam(name = "q", required = false) String q) {
        return ApiResponse.list(service.search(q));
    }

    @GetMapping("/pinned")
    public ApiResponse<List<LinkResponse>> pinned() {
        return ApiResponse.list(service.pinned());
    }

    @GetMapping("/stats")
    public ApiResponse<LinkStats> stats() {
        return ApiResponse.ok(service.stats());
    }
}
