package com.reflex.service.api;

import com.reflex.eventmodel.Event;
import com.reflex.mesh.EventMesh;
import com.reflex.mesh.Publication;
import com.reflex.mesh.SequenceMode;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Publishes events into the mesh. */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventMesh mesh;

    public EventController(EventMesh mesh) {
        this.mesh = mesh;
    }

    /**
     * Answers 201 for a newly stored event, and 200 when a caller-sequenced event was already stored
     * and is returned unchanged.
     */
    @PostMapping
    public ResponseEntity<Event> publish(@Valid @RequestBody PublishEventRequest request) {
        if (mesh.sequenceMode() == SequenceMode.CALLER) {
            if (request.sequence() == null) {
                throw new IllegalArgumentException("sequence is required in CALLER mode");
            }
            Publication publication = mesh.publishSequenced(
                    request.type(), request.source(), request.sequence(), request.payload());
            return ResponseEntity.status(publication.duplicate() ? HttpStatus.OK : HttpStatus.CREATED)
                    .body(publication.event());
        }
        if (request.sequence() != null) {
            throw new IllegalArgumentException("sequence is assigned by the mesh in AUTO mode");
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(mesh.publish(request.type(), request.source(), request.payload()));
    }

    @GetMapping("/sources/{source}")
    public Map<String, Object> source(@PathVariable String source) {
        return Map.of("source", source, "highestSequence", mesh.highestSequence(source));
    }
}
