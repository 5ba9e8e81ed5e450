package io.hivememory.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivememory.acl.AccessLevel;
import io.hivememory.acl.Requester;
import io.hivememory.core.AccessDeniedException;
import io.hivememory.core.StorageException;
import io.hivememory.core.ValidationException;
import io.hivememory.memory.MemoryEntry;
import io.hivememory.memory.MemoryStats;
import io.hivememory.memory.SharedMemory;
import io.hivememory.memory.StoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST access to shared memory for agent runtimes. The acting agent is passed as
 * {@code agentId} (plus optional team, swarm and system flag) on every call.
 */
@RestController
@RequestMapping("/api/memory")
public class MemoryController {

    private static final Logger log = LoggerFactory.getLogger(MemoryController.class);

    private final SharedMemory memory;

    public MemoryController(SharedMemory memory) {
        this.memory = memory;
    }

    /**
     * Creates or updates an entry.
     */
    @PostMapping("/entries")
    public ResponseEntity<EntryView> store(@RequestBody StoreRequest request) {
        try {
            AccessLevel level = request.accessLevel() == null || request.accessLevel().isBlank()
                    ? AccessLevel.PRIVATE
                    : AccessLevel.fromTag(request.accessLevel());
            var options = new StoreOptions(request.partition(), request.ttlSeconds(), level, request.owner(),
                    request.teamId(), request.swarmId());
            return ResponseEntity.ok(EntryView.of(memory.store(request.key(), request.value(), options)));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().build();
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        } catch (StorageException e) {
            log.error("Store of {} failed", request.key(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/entries/{partition}/{key}")
    public ResponseEntity<EntryView> retrieve(@PathVariable String partition, @PathVariable String key,
                                              @RequestParam String agentId,
                                              @RequestParam(required = false) String teamId,
                                              @RequestParam(required = false) String swarmId,
                                              @RequestParam(defaultValue = "false") boolean system) {
        try {
            return memory.retrieveEntry(key, partition, new Requester(agentId, teamId, swarmId, system))
                    .map(entry -> ResponseEntity.ok(EntryView.of(entry)))
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        } catch (StorageException e) {
            log.error("Retrieve of {}:{} failed", partition, key, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Entries of a partition whose key matches {@code pattern} (SQL LIKE), filtered to
     * what the agent may read.
     */
    @GetMapping("/entries/{partition}")
    public ResponseEntity<List<EntryView>> query(@PathVariable String partition,
                                                 @RequestParam(defaultValue = "%") String pattern,
                                                 @RequestParam String agentId,
                                                 @RequestParam(required = false) String teamId,
                                                 @RequestParam(required = false) String swarmId,
                                                 @RequestParam(defaultValue = "false") boolean system) {
        List<MemoryEntry> entries = memory.query(pattern, partition, new Requester(agentId, teamId, swarmId, system));
        return ResponseEntity.ok(entries.stream().map(EntryView::of).toList());
    }

    @DeleteMapping("/entries/{partition}/{key}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String partition, @PathVariable String key,
                                                      @RequestParam String agentId,
                                                      @RequestParam(required = false) String teamId,
                                                      @RequestParam(required = false) String swarmId,
                                                      @RequestParam(defaultValue = "false") boolean system) {
        try {
            if (!memory.delete(key, partition, new Requester(agentId, teamId, swarmId, system))) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(Map.of("status", "deleted", "key", key, "partition", partition));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
    }

    @GetMapping("/status")
    public ResponseEntity<StatusView> status() {
        return ResponseEntity.ok(new StatusView(memory.healthCheck(), memory.stats()));
    }

    /**
     * Request body for storing an entry.
     */
    public record StoreRequest(
            String key,
            JsonNode value,
            String partition,
            Long ttlSeconds,
            String accessLevel,
            String owner,
            String teamId,
            String swarmId
    ) {}

    public record EntryView(
            String key,
            String partition,
            JsonNode value,
            String owner,
            String accessLevel,
            String teamId,
            String swarmId,
            long expiresAt,
            long lastModified
    ) {
        static EntryView of(MemoryEntry entry) {
            return new EntryView(entry.key(), entry.partition(), entry.value(), entry.owner(),
                    entry.accessLevel().tag(), entry.scope().teamId(), entry.scope().swarmId(),
                    entry.expiresAt(), entry.lastModified());
        }
    }

    public record StatusView(boolean healthy, MemoryStats stats) {}
}
