package io.github.dailies.gateway.controller;

import io.github.dailies.protocol.api.CreateFrequencyRequest;
import io.github.dailies.protocol.api.FrequencyDto;
import io.github.dailies.protocol.api.FrequencyTimerDto;
import io.github.dailies.protocol.api.UpdateFrequencyRequest;
import io.github.dailies.runtime.frequency.FrequencyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/frequencies")
public class FrequencyController {

    private final FrequencyService frequencyService;

    public FrequencyController(FrequencyService frequencyService) {
        this.frequencyService = frequencyService;
    }

    @GetMapping
    public List<FrequencyDto> list(@RequestParam(required = false) String name) {
        return frequencyService.list(name);
    }

    @GetMapping("/timers")
    public List<FrequencyTimerDto> timers() {
        return frequencyService.timers();
    }

    @GetMapping("/{id}")
    public FrequencyDto get(@PathVariable String id) {
        return frequencyService.get(id);
    }

    @PostMapping
    public ResponseEntity<FrequencyDto> create(@RequestBody CreateFrequencyRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(frequencyService.create(req));
    }

    @PutMapping("/{id}")
    public ResponseEntity<FrequencyDto> update(@PathVariable String id, @RequestBody UpdateFrequencyRequest req) {
        return ResponseEntity.ok(frequencyService.update(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        frequencyService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
