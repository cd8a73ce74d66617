package com.example.handwritingcomparator.controller;

import com.example.handwritingcomparator.model.api.ComparisonResponse;
import com.example.handwritingcomparator.model.api.HistoryEntry;
import com.example.handwritingcomparator.model.api.MessageResponse;
import com.example.handwritingcomparator.service.history.ComparisonHistoryStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "History", description = "Previously computed comparisons")
public class HistoryController {

    private final ComparisonHistoryStore historyStore;

    public HistoryController(ComparisonHistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    @GetMapping("/history")
    @Operation(summary = "List recent comparisons, newest first")
    public List<HistoryEntry> history(@RequestParam(defaultValue = "20") int limit) {
        return historyStore.recent(limit).stream()
                .map(HistoryEntry::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/comparison/{id}")
    @Operation(summary = "Retrieve a stored comparison")
    public ComparisonResponse comparison(@PathVariable String id) {
        return historyStore.findById(id)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Comparison not found"));
    }

    @DeleteMapping("/history/{id}")
    @Operation(summary = "Delete a stored comparison")
    public MessageResponse delete(@PathVariable String id) {
        if (!historyStore.delete(id)) {
            throw new ResponseStatusException(NOT_FOUND, "Comparison not found");
        }
        return new MessageResponse("Comparison deleted");
    }

    @DeleteMapping("/history")
    @Operation(summary = "Delete all stored comparisons")
    public MessageResponse clear() {
        int removed = historyStore.clear();
        return new MessageResponse("Deleted " + removed + " comparisons");
    }
}
