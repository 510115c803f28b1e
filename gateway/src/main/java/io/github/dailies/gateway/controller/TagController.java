package io.github.dailies.gateway.controller;

import io.github.dailies.protocol.api.CreateTagRequest;
import io.github.dailies.protocol.api.TagDto;
import io.github.dailies.protocol.api.UpdateTagRequest;
import io.github.dailies.runtime.tag.TagService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tags")
public class TagController {

    private final TagService tagService;

    public TagController(TagService tagService) {
        this.tagService = tagService;
    }

    @GetMapping
    public List<TagDto> list(@RequestParam(required = false) String name) {
        return tagService.list(name);
    }

    @GetMapping("/{id}")
    public TagDto get(@PathVariable String id) {
        return tagService.get(id);
    }

    @PostMapping
    public ResponseEntity<TagDto> create(@RequestBody CreateTagRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tagService.create(req));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TagDto> update(@PathVariable String id, @RequestBody UpdateTagRequest req) {
        return ResponseEntity.ok(tagService.update(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        tagService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
